package com.phillippitts.fleetdump.service.coordinator.event;

import com.phillippitts.fleetdump.domain.TriggerReason;

import java.util.List;

/**
 * Asks the coordinator to dump a set of devices. Published by trigger sources (crash monitor,
 * health checks, operator tooling) that should not depend on the coordinator directly.
 *
 * @param trigger why the dump is requested
 * @param deviceIds devices to dump; empty means every attached device
 * @param uploadEnabled explicit upload decision, or null to use the auto-upload setting
 * @param requestDeviceId device that caused the request, if any
 */
public record FleetDumpRequestedEvent(TriggerReason trigger,
                                      List<String> deviceIds,
                                      Boolean uploadEnabled,
                                      String requestDeviceId) {

    public FleetDumpRequestedEvent {
        deviceIds = deviceIds == null ? List.of() : List.copyOf(deviceIds);
    }
}
