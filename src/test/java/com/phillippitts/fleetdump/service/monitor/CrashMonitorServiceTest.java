package com.phillippitts.fleetdump.service.monitor;

import com.phillippitts.fleetdump.config.properties.CrashMonitorProperties;
import com.phillippitts.fleetdump.domain.TriggerReason;
import com.phillippitts.fleetdump.service.coordinator.event.FleetDumpCompletedEvent;
import com.phillippitts.fleetdump.service.coordinator.event.FleetDumpErrorEvent;
import com.phillippitts.fleetdump.service.coordinator.event.FleetDumpRequestedEvent;
import com.phillippitts.fleetdump.service.device.ShellResult;
import com.phillippitts.fleetdump.testutil.EventCapturingPublisher;
import com.phillippitts.fleetdump.testutil.RecordingDeviceTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CrashMonitorServiceTest {

    private RecordingDeviceTransport transport;
    private EventCapturingPublisher publisher;
    private CrashMonitorService monitor;

    @BeforeEach
    void setUp() {
        transport = new RecordingDeviceTransport();
        publisher = new EventCapturingPublisher();
        monitor = new CrashMonitorService(transport, () -> List.of("d1", "d2", "d3"), publisher,
                new CrashMonitorProperties(true, 1000L, "/data/coredump"));
    }

    @Test
    void firstCrashRequestsOneFleetDumpAndPauses() {
        transport.respondWith((device, cmd) -> device.equals("d2") ? ShellResult.ok("core.1\n") : ShellResult.ok(""));

        monitor.poll();

        FleetDumpRequestedEvent request = publisher.lastOf(FleetDumpRequestedEvent.class);
        assertThat(request.trigger()).isEqualTo(TriggerReason.CRASH_MONITOR);
        assertThat(request.deviceIds()).isEmpty();
        assertThat(request.requestDeviceId()).isEqualTo("d2");
        assertThat(publisher.lastOf(CrashDetectedEvent.class).coredumpFiles()).containsExactly("core.1");
        // d3 is not checked once a crash is found
        assertThat(transport.commands()).extracting(RecordingDeviceTransport.Command::deviceId)
                .containsExactly("d1", "d2");
        assertThat(transport.commands().get(0).shellCommand()).isEqualTo("ls /data/coredump");
        assertThat(monitor.isPaused()).isTrue();

        monitor.poll();
        assertThat(publisher.eventsOf(FleetDumpRequestedEvent.class)).hasSize(1);
    }

    @Test
    void resumesWhenTheFleetDumpCompletesOrFails() {
        transport.respondWith((device, cmd) -> ShellResult.ok("core.1"));
        monitor.poll();

        monitor.onFleetDumpCompleted(new FleetDumpCompletedEvent("251019-101530", 1, 0, 0, Path.of("/tmp")));
        assertThat(monitor.isPaused()).isFalse();

        monitor.poll();
        assertThat(monitor.isPaused()).isTrue();
        monitor.onFleetDumpError(new FleetDumpErrorEvent(null, "no-devices", "No active devices to dump", Instant.now()));
        assertThat(monitor.isPaused()).isFalse();
    }

    @Test
    void unreachableDevicesAreSkipped() {
        transport.respondWith((device, cmd) -> ShellResult.unavailable("adb not available"));

        monitor.poll();

        assertThat(publisher.events()).isEmpty();
        assertThat(monitor.isPaused()).isFalse();
    }
}
