package com.phillippitts.fleetdump.service.coordinator.event;

import java.time.Instant;

/**
 * A request could not be admitted or failed before any device was dumped.
 *
 * @param issueId request id if one was assigned, otherwise null
 * @param reason short machine-friendly reason (e.g. {@code no-devices}, {@code issue-dir})
 * @param message human-readable detail
 */
public record FleetDumpErrorEvent(String issueId, String reason, String message, Instant at) {
}
