package com.phillippitts.fleetdump.exception;

/**
 * Thrown when a dump request cannot be admitted: no devices, bad trigger, unusable issue directory.
 */
public class InvalidDumpRequestException extends FleetDumpException {

    public InvalidDumpRequestException(String message) {
        super(message);
    }

    public InvalidDumpRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
