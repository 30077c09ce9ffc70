package com.phillippitts.fleetdump.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable summary of one fleet request, persisted as {@code manifest.json} in the issue root.
 *
 * <p>Fields map one-to-one onto the JSON keys; {@code uploadResult} stays null until an upload
 * has been attempted or declined. {@code uploadEnabled} is null when the request left the decision
 * to the auto-upload setting.
 */
public record Manifest(String issueId,
                       String triggeredBy,
                       String pathStrategy,
                       String requestDeviceId,
                       List<String> targets,
                       Map<String, DeviceResult> results,
                       int successCount,
                       int failCount,
                       int cancelledCount,
                       String issueDir,
                       Boolean uploadEnabled,
                       Instant createdAt,
                       UploadOutcome uploadResult,
                       boolean recovered) {

    public Manifest {
        targets = List.copyOf(targets);
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public Manifest withUploadResult(UploadOutcome outcome) {
        return new Manifest(issueId, triggeredBy, pathStrategy, requestDeviceId, targets, results,
                successCount, failCount, cancelledCount, issueDir, uploadEnabled, createdAt, outcome, recovered);
    }

    /**
     * Returns true when every target has a recorded result.
     */
    public boolean isComplete() {
        return results.keySet().containsAll(targets);
    }
}
