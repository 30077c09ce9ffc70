package com.phillippitts.fleetdump.service.coordinator.event;

import com.phillippitts.fleetdump.domain.UploadOutcome;

import java.nio.file.Path;

/**
 * An upload finished, failed or was declined; the manifest has been updated.
 */
public record UploadCompletedEvent(UploadOutcome outcome, Path issueRoot) {
}
