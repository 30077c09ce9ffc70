package com.phillippitts.fleetdump.service.dump.event;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Operator notice published when an interactive dump finishes (success or failure).
 * Headless jobs and cancelled jobs do not publish it.
 */
public record DumpCompletionNoticeEvent(String deviceId,
                                        boolean success,
                                        String message,
                                        Path workingDirectory,
                                        Instant at) {
}
