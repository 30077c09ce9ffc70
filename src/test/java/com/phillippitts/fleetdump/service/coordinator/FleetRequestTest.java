package com.phillippitts.fleetdump.service.coordinator;

import com.phillippitts.fleetdump.domain.DumpMode;
import com.phillippitts.fleetdump.domain.DumpOutcome;
import com.phillippitts.fleetdump.domain.DumpState;
import com.phillippitts.fleetdump.domain.FailureKind;
import com.phillippitts.fleetdump.domain.FleetStatus;
import com.phillippitts.fleetdump.domain.Manifest;
import com.phillippitts.fleetdump.domain.TriggerReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FleetRequestTest {

    private static final Path ROOT = Path.of("/var/log/fleet/issues/251019-101530");

    private FleetRequest request;

    @BeforeEach
    void setUp() {
        Map<String, Path> dirs = new LinkedHashMap<>();
        for (String device : new String[]{"d1", "d2", "d3"}) {
            dirs.put(device, ROOT.resolve(device));
        }
        request = new FleetRequest("251019-101530", TriggerReason.HEALTH_CHECK_FAILED, DumpMode.HEADLESS, dirs,
                ROOT, null, "d2", "unified", Instant.parse("2025-10-19T10:15:30Z"));
    }

    private static DumpOutcome success(String device) {
        return DumpOutcome.success(device, "ok", ROOT.resolve(device), Duration.ofSeconds(3));
    }

    @Test
    void pendingDevicesComeOutInTargetOrder() {
        assertThat(request.nextPending()).isEqualTo("d1");
        assertThat(request.nextPending()).isEqualTo("d2");
        assertThat(request.nextPending()).isEqualTo("d3");
        assertThat(request.hasPending()).isFalse();
    }

    @Test
    void recordsEachDeviceExactlyOnce() {
        assertThat(request.record(success("d1"))).isTrue();
        assertThat(request.record(DumpOutcome.failed("d1", FailureKind.PROCESS, "late", null, Duration.ZERO)))
                .isFalse();

        assertThat(request.successCount()).isEqualTo(1);
        assertThat(request.failCount()).isZero();
        assertThat(request.completedCount()).isEqualTo(1);
    }

    @Test
    void ignoresOutcomesForDevicesOutsideTheRequest() {
        assertThat(request.record(success("stranger"))).isFalse();
        assertThat(request.completedCount()).isZero();
    }

    @Test
    void countsAlwaysAddUpToCompleted() {
        request.record(success("d1"));
        request.record(DumpOutcome.failed("d2", FailureKind.TIMEOUT, "timed out", null, Duration.ZERO));
        request.record(DumpOutcome.cancelled("d3", ROOT.resolve("d3"), Duration.ZERO));

        assertThat(request.successCount() + request.failCount() + request.cancelledCount())
                .isEqualTo(request.completedCount())
                .isEqualTo(3);
        assertThat(request.isFinished()).isTrue();
    }

    @Test
    void recordingAQueuedDeviceRemovesItFromThePendingQueue() {
        request.nextPending();
        request.record(DumpOutcome.failed("d2", FailureKind.SETUP, "no dir", null, Duration.ZERO));

        assertThat(request.nextPending()).isEqualTo("d3");
        assertThat(request.hasPending()).isFalse();
    }

    @Test
    void manifestReflectsRecordedResults() {
        request.record(success("d3"));

        Manifest manifest = request.toManifest();

        assertThat(manifest.triggeredBy()).isEqualTo("qs_failed");
        assertThat(manifest.requestDeviceId()).isEqualTo("d2");
        assertThat(manifest.results()).containsOnlyKeys("d3");
        assertThat(manifest.successCount()).isEqualTo(1);
        assertThat(manifest.issueDir()).isEqualTo(ROOT.toString());
        assertThat(manifest.uploadEnabled()).isNull();
        assertThat(manifest.isComplete()).isFalse();
    }

    @Test
    void snapshotReportsQueuedAndIdleDevices() {
        request.nextPending();

        FleetStatus status = request.snapshot();

        assertThat(status.total()).isEqualTo(3);
        assertThat(status.queued()).isEqualTo(2);
        assertThat(status.inflight()).isZero();
        assertThat(status.deviceStates()).containsEntry("d1", DumpState.IDLE);
    }

    @Test
    void rejectsEmptyTargetList() {
        assertThatThrownBy(() -> new FleetRequest("x", TriggerReason.MANUAL, DumpMode.INTERACTIVE, Map.of(),
                ROOT, null, null, "unified", Instant.now()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
