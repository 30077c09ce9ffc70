package com.phillippitts.fleetdump.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and output-reader lifecycle management.
 *
 * <p>Extraction deadlines and the cancellation grace period are configurable
 * ({@code dump.*}); the values here only bound the housekeeping around a process.
 *
 * @see com.phillippitts.fleetdump.service.dump.DumpJob
 * @see com.phillippitts.fleetdump.service.device.AdbDeviceTransport
 */
public final class ProcessTimeouts {

    /**
     * Timeout for output reader threads to flush buffered output after process completion.
     */
    public static final Duration OUTPUT_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for output reader threads during cleanup (best-effort).
     */
    public static final Duration OUTPUT_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()} on short-lived helper
     * processes (adb shell, upload CLI).
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     *
     * <p>Processes that survive this are typically unkillable due to OS bugs.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
