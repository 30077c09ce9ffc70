package com.phillippitts.fleetdump.config.properties;

import com.phillippitts.fleetdump.domain.DumpMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed properties for fleet dump coordination and extraction jobs ({@code dump.*}).
 *
 * <p>Upload and crash monitor settings live under their own prefixes, see
 * {@link UploadProperties} and {@link CrashMonitorProperties}.
 */
@Validated
@ConfigurationProperties(prefix = "dump")
public class DumpProperties {

    /** Upper bound on simultaneously running extractions. */
    @Min(1)
    @Max(16)
    private int maxConcurrency = 3;

    @NotBlank
    private String logDirectory = "logs";

    /** unified, individual or hybrid; anything else falls back to unified. */
    @NotBlank
    private String pathStrategy = "unified";

    @NotBlank
    private String directoryPrefix = "issues";

    private boolean autoUploadEnabled = true;

    @NotBlank
    private String scriptPath = "scripts/coredump_extraction_script.sh";

    @NotNull
    private Duration headlessTimeout = Duration.ofSeconds(300);

    @NotNull
    private Duration interactiveTimeout = Duration.ofSeconds(600);

    @NotNull
    private Duration cancelGracePeriod = Duration.ofSeconds(5);

    @NotNull
    private Duration progressInterval = Duration.ofSeconds(1);

    /** Shell commands run on the device after a confirmed cancellation. */
    private List<String> cleanupCommands = new ArrayList<>();

    /** Items whose absence from a finished dump is logged as a warning. */
    private List<String> requiredItems = new ArrayList<>(List.of("sw_version.txt", "coredump"));

    @Valid
    private Mode mode = new Mode();

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public String getLogDirectory() {
        return logDirectory;
    }

    public void setLogDirectory(String logDirectory) {
        this.logDirectory = logDirectory;
    }

    public String getPathStrategy() {
        return pathStrategy;
    }

    public void setPathStrategy(String pathStrategy) {
        this.pathStrategy = pathStrategy;
    }

    public String getDirectoryPrefix() {
        return directoryPrefix;
    }

    public void setDirectoryPrefix(String directoryPrefix) {
        this.directoryPrefix = directoryPrefix;
    }

    public boolean isAutoUploadEnabled() {
        return autoUploadEnabled;
    }

    public void setAutoUploadEnabled(boolean autoUploadEnabled) {
        this.autoUploadEnabled = autoUploadEnabled;
    }

    public String getScriptPath() {
        return scriptPath;
    }

    public void setScriptPath(String scriptPath) {
        this.scriptPath = scriptPath;
    }

    public Duration getHeadlessTimeout() {
        return headlessTimeout;
    }

    public void setHeadlessTimeout(Duration headlessTimeout) {
        this.headlessTimeout = headlessTimeout;
    }

    public Duration getInteractiveTimeout() {
        return interactiveTimeout;
    }

    public void setInteractiveTimeout(Duration interactiveTimeout) {
        this.interactiveTimeout = interactiveTimeout;
    }

    public Duration getCancelGracePeriod() {
        return cancelGracePeriod;
    }

    public void setCancelGracePeriod(Duration cancelGracePeriod) {
        this.cancelGracePeriod = cancelGracePeriod;
    }

    public Duration getProgressInterval() {
        return progressInterval;
    }

    public void setProgressInterval(Duration progressInterval) {
        this.progressInterval = progressInterval;
    }

    public List<String> getCleanupCommands() {
        return cleanupCommands;
    }

    public void setCleanupCommands(List<String> cleanupCommands) {
        this.cleanupCommands = cleanupCommands;
    }

    public List<String> getRequiredItems() {
        return requiredItems;
    }

    public void setRequiredItems(List<String> requiredItems) {
        this.requiredItems = requiredItems;
    }

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    /**
     * Which {@link DumpMode} each kind of trigger runs in.
     */
    public static class Mode {
        @NotNull
        private DumpMode manual = DumpMode.INTERACTIVE;

        @NotNull
        private DumpMode automated = DumpMode.HEADLESS;

        public DumpMode getManual() {
            return manual;
        }

        public void setManual(DumpMode manual) {
            this.manual = manual;
        }

        public DumpMode getAutomated() {
            return automated;
        }

        public void setAutomated(DumpMode automated) {
            this.automated = automated;
        }
    }
}
