package com.phillippitts.fleetdump.exception;

/**
 * Thrown when a dump job cannot be started: the working directory cannot be created
 * or the extraction script is missing. No process is launched.
 */
public class DumpSetupException extends FleetDumpException {

    private final String deviceId;

    public DumpSetupException(String message, String deviceId) {
        super(message + " (device: " + deviceId + ")");
        this.deviceId = deviceId;
    }

    public DumpSetupException(String message, String deviceId, Throwable cause) {
        super(message + " (device: " + deviceId + ")", cause);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
