package com.phillippitts.fleetdump.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of shipping a request's issue directory to the artifact store.
 *
 * @param issueId request the upload belongs to
 * @param success whether every file reached the store
 * @param message summary from the upload pipeline
 * @param uploadedFiles issue-relative paths of the files that were offered for upload
 * @param uploadInfo pipeline-specific detail (repository, target path)
 * @param completedAt when the upload finished
 */
public record UploadOutcome(String issueId,
                            boolean success,
                            String message,
                            List<String> uploadedFiles,
                            Map<String, String> uploadInfo,
                            Instant completedAt) {

    public static final String DECLINED_MESSAGE = "Upload declined by operator";

    public UploadOutcome {
        uploadedFiles = uploadedFiles == null ? List.of() : List.copyOf(uploadedFiles);
        uploadInfo = uploadInfo == null ? Map.of() : Map.copyOf(uploadInfo);
        message = message == null ? "" : message;
    }

    public static UploadOutcome declined(String issueId, Instant at) {
        return new UploadOutcome(issueId, false, DECLINED_MESSAGE, List.of(), Map.of(), at);
    }

    public boolean isDeclined() {
        return !success && DECLINED_MESSAGE.equals(message);
    }
}
