package com.phillippitts.fleetdump.exception;

/**
 * Base exception for all fleetdump application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class FleetDumpException extends RuntimeException {

    public FleetDumpException(String message) {
        super(message);
    }

    public FleetDumpException(String message, Throwable cause) {
        super(message, cause);
    }

    public FleetDumpException(Throwable cause) {
        super(cause);
    }
}
