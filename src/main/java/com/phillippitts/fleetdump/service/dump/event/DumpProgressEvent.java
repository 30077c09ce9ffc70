package com.phillippitts.fleetdump.service.dump.event;

import java.time.Instant;

/**
 * Human-readable progress message from a running dump job.
 */
public record DumpProgressEvent(String deviceId, String message, Instant at) {
}
