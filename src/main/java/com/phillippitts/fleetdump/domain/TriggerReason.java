package com.phillippitts.fleetdump.domain;

import java.util.Locale;

/**
 * Why a fleet dump was requested. The wire value is what the manifest records under
 * {@code triggered_by}.
 */
public enum TriggerReason {
    MANUAL("manual"),
    CRASH_MONITOR("crash_monitor"),
    HEALTH_CHECK_FAILED("qs_failed");

    private final String value;

    TriggerReason(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Automated triggers run headless by default and upload without asking.
     */
    public boolean isAutomated() {
        return this != MANUAL;
    }

    /**
     * Parses either the wire value ({@code qs_failed}) or the enum name ({@code HEALTH_CHECK_FAILED}).
     *
     * @throws IllegalArgumentException if the value matches neither
     */
    public static TriggerReason fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("trigger must not be blank");
        }
        String trimmed = raw.trim();
        for (TriggerReason reason : values()) {
            if (reason.value.equalsIgnoreCase(trimmed) || reason.name().equalsIgnoreCase(trimmed)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown trigger: " + trimmed.toLowerCase(Locale.ROOT));
    }
}
