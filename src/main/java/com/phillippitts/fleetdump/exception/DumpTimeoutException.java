package com.phillippitts.fleetdump.exception;

import java.time.Duration;

/**
 * Thrown when an extraction exceeds its mode's deadline.
 */
public class DumpTimeoutException extends FleetDumpException {

    private final String deviceId;
    private final Duration timeout;

    public DumpTimeoutException(String deviceId, Duration timeout) {
        super("Dump extraction timed out after " + timeout.toSeconds() + "s (device: " + deviceId + ")");
        this.deviceId = deviceId;
        this.timeout = timeout;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
