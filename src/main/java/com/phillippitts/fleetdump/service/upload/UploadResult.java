package com.phillippitts.fleetdump.service.upload;

import java.util.Map;

/**
 * Result of one {@link UploadPipeline} call.
 *
 * @param success whether the store accepted the upload
 * @param message summary suitable for the manifest and operator
 * @param data pipeline-specific detail (repository, target path, link)
 */
public record UploadResult(boolean success, String message, Map<String, String> data) {

    public UploadResult {
        message = message == null ? "" : message;
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static UploadResult failure(String message) {
        return new UploadResult(false, message, Map.of());
    }
}
