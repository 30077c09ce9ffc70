package com.phillippitts.fleetdump.service.manifest;

import com.phillippitts.fleetdump.domain.DeviceResult;
import com.phillippitts.fleetdump.domain.Manifest;
import com.phillippitts.fleetdump.domain.OutcomeStatus;
import com.phillippitts.fleetdump.domain.UploadOutcome;
import com.phillippitts.fleetdump.exception.ManifestReadException;
import com.phillippitts.fleetdump.exception.ManifestWriteException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestStoreTest {

    @TempDir
    Path issueRoot;

    private final ManifestStore store = new ManifestStore();

    private Manifest manifest() {
        Map<String, DeviceResult> results = new LinkedHashMap<>();
        results.put("d1", new DeviceResult(true, OutcomeStatus.SUCCESS, "Dump completed successfully - 1 zip files created",
                issueRoot.resolve("d1").toString()));
        results.put("d2", new DeviceResult(false, OutcomeStatus.CANCELLED, "cancelled", null));
        return new Manifest("251019-101530", "crash_monitor", "unified", "d1", List.of("d1", "d2", "d3"), results,
                1, 0, 1, issueRoot.toString(), null, Instant.parse("2025-10-19T10:15:30Z"), null, false);
    }

    @Test
    void writesSnakeCaseDocument() throws IOException {
        store.write(issueRoot, manifest());

        JSONObject json = new JSONObject(Files.readString(issueRoot.resolve(ManifestStore.FILE_NAME)));
        assertThat(json.getString("issue_id")).isEqualTo("251019-101530");
        assertThat(json.getString("triggered_by")).isEqualTo("crash_monitor");
        assertThat(json.getJSONArray("targets").length()).isEqualTo(3);
        assertThat(json.getInt("success_count")).isEqualTo(1);
        assertThat(json.getInt("cancelled_count")).isEqualTo(1);
        assertThat(json.isNull("upload_enabled")).isTrue();
        assertThat(json.isNull("upload_result")).isTrue();
        assertThat(json.getJSONObject("results").getJSONObject("d2").getString("status")).isEqualTo("cancelled");
        assertThat(json.has("recovered")).isFalse();
        assertThat(Files.exists(issueRoot.resolve(ManifestStore.FILE_NAME + ".tmp"))).isFalse();
    }

    @Test
    void readReturnsWhatWasWritten() {
        Manifest written = manifest();
        store.write(issueRoot, written);

        Manifest read = store.read(issueRoot).orElseThrow();

        assertThat(read.issueId()).isEqualTo(written.issueId());
        assertThat(read.targets()).containsExactly("d1", "d2", "d3");
        assertThat(read.results()).containsOnlyKeys("d1", "d2");
        assertThat(read.results().get("d1")).isEqualTo(written.results().get("d1"));
        assertThat(read.results().get("d2").dumpPath()).isNull();
        assertThat(read.createdAt()).isEqualTo(written.createdAt());
        assertThat(read.uploadEnabled()).isNull();
        assertThat(read.isComplete()).isFalse();
    }

    @Test
    void missingManifestReadsAsEmpty() {
        assertThat(store.read(issueRoot)).isEmpty();
    }

    @Test
    void corruptManifestFailsToRead() throws IOException {
        Files.writeString(issueRoot.resolve(ManifestStore.FILE_NAME), "{ not json");

        assertThatThrownBy(() -> store.read(issueRoot)).isInstanceOf(ManifestReadException.class);
    }

    @Test
    void writeIntoMissingDirectoryFails() {
        assertThatThrownBy(() -> store.write(issueRoot.resolve("gone"), manifest()))
                .isInstanceOf(ManifestWriteException.class);
    }

    @Test
    void uploadResultIsMergedIntoExistingManifest() {
        store.write(issueRoot, manifest());
        UploadOutcome outcome = new UploadOutcome("251019-101530", true, "Uploaded to device-dumps/fleet/251019-101530/",
                List.of("d1/coredump.zip"), Map.of("repository", "device-dumps"), Instant.parse("2025-10-19T10:20:00Z"));

        assertThat(store.recordUploadResult(issueRoot, outcome)).isTrue();

        Manifest updated = store.read(issueRoot).orElseThrow();
        assertThat(updated.uploadResult().success()).isTrue();
        assertThat(updated.uploadResult().uploadedFiles()).containsExactly("d1/coredump.zip");
        assertThat(updated.uploadResult().uploadInfo()).containsEntry("repository", "device-dumps");
        assertThat(updated.successCount()).isEqualTo(1);
        assertThat(updated.results()).hasSize(2);
    }

    @Test
    void uploadResultWithoutManifestIsNotRecorded() {
        UploadOutcome declined = UploadOutcome.declined("x", Instant.now());

        assertThat(store.recordUploadResult(issueRoot, declined)).isFalse();
        assertThat(Files.exists(store.manifestPath(issueRoot))).isFalse();
    }
}
