package com.phillippitts.fleetdump.service.dump;

import com.phillippitts.fleetdump.config.properties.DumpProperties;
import com.phillippitts.fleetdump.domain.DumpMode;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable knobs shared by every dump job.
 *
 * @param scriptPath extraction script, launched with the device directory as working directory
 * @param headlessTimeout extraction deadline for headless jobs
 * @param interactiveTimeout extraction deadline for interactive jobs
 * @param cancelGracePeriod how long a cancelled process may take to exit before it is killed
 * @param progressInterval cadence of headless progress messages and deadline checks
 * @param requiredItems names whose absence from a finished dump is logged
 * @param cleanupCommands device shell commands run after a confirmed cancellation
 */
public record DumpJobSettings(Path scriptPath,
                              Duration headlessTimeout,
                              Duration interactiveTimeout,
                              Duration cancelGracePeriod,
                              Duration progressInterval,
                              List<String> requiredItems,
                              List<String> cleanupCommands) {

    public DumpJobSettings {
        Objects.requireNonNull(scriptPath, "scriptPath");
        requirePositive(headlessTimeout, "headlessTimeout");
        requirePositive(interactiveTimeout, "interactiveTimeout");
        requirePositive(progressInterval, "progressInterval");
        Objects.requireNonNull(cancelGracePeriod, "cancelGracePeriod");
        requiredItems = requiredItems == null ? List.of() : List.copyOf(requiredItems);
        cleanupCommands = cleanupCommands == null ? List.of() : List.copyOf(cleanupCommands);
    }

    public static DumpJobSettings from(DumpProperties props) {
        return new DumpJobSettings(
                Path.of(props.getScriptPath()).toAbsolutePath().normalize(),
                props.getHeadlessTimeout(),
                props.getInteractiveTimeout(),
                props.getCancelGracePeriod(),
                props.getProgressInterval(),
                props.getRequiredItems(),
                props.getCleanupCommands());
    }

    public Duration timeoutFor(DumpMode mode) {
        return mode == DumpMode.HEADLESS ? headlessTimeout : interactiveTimeout;
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
