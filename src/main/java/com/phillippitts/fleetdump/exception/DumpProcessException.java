package com.phillippitts.fleetdump.exception;

/**
 * Thrown when the extraction process fails to launch, crashes, or exits non-zero.
 * Usually constructed through {@link DumpExceptionBuilder} so the message carries exit code
 * and output context.
 */
public class DumpProcessException extends FleetDumpException {

    private final String deviceId;
    private final Integer exitCode;

    public DumpProcessException(String message, String deviceId, Integer exitCode) {
        super(message);
        this.deviceId = deviceId;
        this.exitCode = exitCode;
    }

    public DumpProcessException(String message, String deviceId, Integer exitCode, Throwable cause) {
        super(message, cause);
        this.deviceId = deviceId;
        this.exitCode = exitCode;
    }

    public String getDeviceId() {
        return deviceId;
    }

    /**
     * Returns the process exit code, or null if the process never ran to exit.
     */
    public Integer getExitCode() {
        return exitCode;
    }
}
