package com.phillippitts.fleetdump.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the on-device coredump poller.
 */
@Validated
@ConfigurationProperties(prefix = "dump.crash-monitor")
public class CrashMonitorProperties {

    private final boolean enabled;

    @Min(500)
    private final long intervalMs;

    @NotBlank
    private final String coredumpPath;

    @ConstructorBinding
    public CrashMonitorProperties(Boolean enabled, Long intervalMs, String coredumpPath) {
        this.enabled = enabled != null && enabled;
        this.intervalMs = intervalMs == null ? 5_000L : intervalMs;
        this.coredumpPath = coredumpPath == null || coredumpPath.isBlank()
                ? "/data/var/lib/systemd/systemd-coredump/" : coredumpPath;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public String getCoredumpPath() {
        return coredumpPath;
    }
}
