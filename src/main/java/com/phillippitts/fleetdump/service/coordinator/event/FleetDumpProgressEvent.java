package com.phillippitts.fleetdump.service.coordinator.event;

/**
 * One more device of the active request reached a terminal outcome.
 */
public record FleetDumpProgressEvent(String issueId, String deviceId, int completed, int total) {
}
