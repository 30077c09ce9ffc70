package com.phillippitts.fleetdump.domain;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Terminal result reported exactly once per dump job.
 *
 * @param deviceId device the job ran against
 * @param status success, failure or cancellation
 * @param failureKind failure classification, null unless {@code status == FAILED}
 * @param detail human-readable detail (success summary or failure reason)
 * @param workingDirectory directory the extraction wrote into (may be null for early setup failures)
 * @param elapsed wall time from start to outcome
 */
public record DumpOutcome(String deviceId,
                          OutcomeStatus status,
                          FailureKind failureKind,
                          String detail,
                          Path workingDirectory,
                          Duration elapsed) {

    public DumpOutcome {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(status, "status");
        if (status == OutcomeStatus.FAILED && failureKind == null) {
            throw new IllegalArgumentException("failed outcome requires a failure kind");
        }
        if (status != OutcomeStatus.FAILED && failureKind != null) {
            throw new IllegalArgumentException("failure kind is only valid for failed outcomes");
        }
        detail = detail == null ? "" : detail;
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public static DumpOutcome success(String deviceId, String detail, Path workingDirectory, Duration elapsed) {
        return new DumpOutcome(deviceId, OutcomeStatus.SUCCESS, null, detail, workingDirectory, elapsed);
    }

    public static DumpOutcome failed(String deviceId, FailureKind kind, String detail,
                                     Path workingDirectory, Duration elapsed) {
        return new DumpOutcome(deviceId, OutcomeStatus.FAILED, kind, detail, workingDirectory, elapsed);
    }

    public static DumpOutcome cancelled(String deviceId, Path workingDirectory, Duration elapsed) {
        return new DumpOutcome(deviceId, OutcomeStatus.CANCELLED, null, "cancelled", workingDirectory, elapsed);
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }
}
