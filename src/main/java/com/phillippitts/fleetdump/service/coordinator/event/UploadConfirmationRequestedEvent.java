package com.phillippitts.fleetdump.service.coordinator.event;

import java.nio.file.Path;
import java.util.List;

/**
 * A manually triggered request finished with at least one good dump and waits for the operator
 * to confirm or decline the upload.
 */
public record UploadConfirmationRequestedEvent(String issueId,
                                               Path issueRoot,
                                               String remotePath,
                                               List<String> targets,
                                               int successCount) {
}
