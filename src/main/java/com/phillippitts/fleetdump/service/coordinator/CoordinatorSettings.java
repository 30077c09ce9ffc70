package com.phillippitts.fleetdump.service.coordinator;

import com.phillippitts.fleetdump.config.properties.DumpProperties;
import com.phillippitts.fleetdump.config.properties.UploadProperties;
import com.phillippitts.fleetdump.domain.DumpMode;
import com.phillippitts.fleetdump.domain.TriggerReason;

import java.util.Objects;

/**
 * Coordinator knobs that may change at runtime through
 * {@link FleetDumpCoordinator#updateSettings(CoordinatorSettings)}.
 *
 * <p>The path naming strategy is fixed when the coordinator is built and is not part of this
 * record.
 *
 * @param maxConcurrency upper bound on simultaneously running jobs
 * @param autoUploadEnabled upload decision for requests that do not state one
 * @param manualMode mode for operator-initiated dumps
 * @param automatedMode mode for monitor and health-check dumps
 * @param uploadDirectoryPrefix remote folder the issue id is appended to
 */
public record CoordinatorSettings(int maxConcurrency,
                                  boolean autoUploadEnabled,
                                  DumpMode manualMode,
                                  DumpMode automatedMode,
                                  String uploadDirectoryPrefix) {

    public CoordinatorSettings {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        Objects.requireNonNull(manualMode, "manualMode");
        Objects.requireNonNull(automatedMode, "automatedMode");
        uploadDirectoryPrefix = uploadDirectoryPrefix == null ? "" : uploadDirectoryPrefix;
    }

    public static CoordinatorSettings from(DumpProperties dump, UploadProperties upload) {
        return new CoordinatorSettings(dump.getMaxConcurrency(), dump.isAutoUploadEnabled(),
                dump.getMode().getManual(), dump.getMode().getAutomated(), upload.getDirectoryPrefix());
    }

    public DumpMode modeFor(TriggerReason trigger) {
        return trigger.isAutomated() ? automatedMode : manualMode;
    }

    /**
     * Remote path for an issue: {@code <prefix>/<issueId>}, or just the issue id without a prefix.
     */
    public String remotePathFor(String issueId) {
        String prefix = uploadDirectoryPrefix.strip();
        while (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix.isEmpty() ? issueId : prefix + "/" + issueId;
    }
}
