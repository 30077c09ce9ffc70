package com.phillippitts.fleetdump.service.coordinator.event;

import java.nio.file.Path;

/**
 * Every target of a request has a recorded result.
 */
public record FleetDumpCompletedEvent(String issueId,
                                      int successCount,
                                      int failCount,
                                      int cancelledCount,
                                      Path issueRoot) {
}
