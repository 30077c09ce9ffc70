package com.phillippitts.fleetdump.presentation.exception;

import com.phillippitts.fleetdump.exception.FleetBusyException;
import com.phillippitts.fleetdump.exception.FleetDumpException;
import com.phillippitts.fleetdump.exception.InvalidDumpRequestException;
import com.phillippitts.fleetdump.exception.UnknownDeviceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts fleetdump exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping local paths and process output out of responses.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * A fleet dump is already running (HTTP 409).
     */
    @ExceptionHandler(FleetBusyException.class)
    ResponseEntity<ApiError> handleBusy(FleetBusyException ex) {
        LOG.info("Rejected dump request: issue {} still in progress", ex.getActiveIssueId());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Fleet dump already in progress",
                "Active issue: " + ex.getActiveIssueId(),
                Instant.now()
            ));
    }

    /**
     * Operation on a device without a running job (HTTP 404).
     */
    @ExceptionHandler(UnknownDeviceException.class)
    ResponseEntity<ApiError> handleUnknownDevice(UnknownDeviceException ex) {
        LOG.warn("Unknown device: {}", ex.getDeviceId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "No active dump job for device",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - request cannot be admitted (HTTP 400).
     */
    @ExceptionHandler(InvalidDumpRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidDumpRequestException ex) {
        LOG.warn("Invalid dump request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid dump request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        LOG.warn("Request validation failed: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "ValidationFailed",
                "Invalid request body",
                details,
                Instant.now()
            ));
    }

    /**
     * Server-side dump failure - retry possible (HTTP 503).
     */
    @ExceptionHandler(FleetDumpException.class)
    ResponseEntity<ApiError> handleFleetDumpFailure(FleetDumpException ex) {
        LOG.error("Fleet dump operation failed", ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Dump service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
