package com.phillippitts.fleetdump.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link DumpProcessException} with exit code, timing and output context.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw DumpExceptionBuilder.create("Dump script failed")
 *         .device(serial)
 *         .exitCode(2)
 *         .durationMs(41_250)
 *         .metadata("script", scriptPath)
 *         .metadata("output", outputSnippet)
 *         .build();
 * </pre>
 */
public final class DumpExceptionBuilder {

    private final String message;
    private String deviceId;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private DumpExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static DumpExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new DumpExceptionBuilder(message);
    }

    public DumpExceptionBuilder device(String deviceId) {
        this.deviceId = deviceId;
        return this;
    }

    public DumpExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public DumpExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public DumpExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value pair to the message. Null keys or values are skipped.
     */
    public DumpExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The message format is:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     */
    public DumpProcessException build() {
        String detailedMessage = buildDetailedMessage();
        String device = deviceId != null ? deviceId : "unknown";
        if (cause != null) {
            return new DumpProcessException(detailedMessage, device, exitCode, cause);
        }
        return new DumpProcessException(detailedMessage, device, exitCode);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
