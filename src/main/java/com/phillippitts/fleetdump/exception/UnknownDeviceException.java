package com.phillippitts.fleetdump.exception;

/**
 * Thrown when an operation names a device that has no live dump job.
 */
public class UnknownDeviceException extends FleetDumpException {

    private final String deviceId;

    public UnknownDeviceException(String deviceId) {
        super("No active dump job for device: " + deviceId);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
