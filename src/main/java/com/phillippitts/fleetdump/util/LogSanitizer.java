package com.phillippitts.fleetdump.util;

/** Utility for bounded logging of subprocess output. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Keep the last max characters of the input, collapsed onto one line. Script failures are
     * usually explained at the end of their output.
     */
    public static String tail(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String trimmed = s.strip();
        String tail = trimmed.length() <= max ? trimmed : trimmed.substring(trimmed.length() - max);
        return tail.replace('\r', ' ').replace('\n', ' ');
    }
}
