package com.phillippitts.fleetdump.util;

import java.time.Duration;

/**
 * Utility methods for monotonic elapsed-time calculations based on {@link System#nanoTime()}.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Elapsed time between two readings of the same nanosecond clock, never negative.
     */
    public static Duration between(long startNanos, long endNanos) {
        return Duration.ofNanos(Math.max(0L, endNanos - startNanos));
    }
}
