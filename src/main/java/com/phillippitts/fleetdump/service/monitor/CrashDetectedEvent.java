package com.phillippitts.fleetdump.service.monitor;

import java.time.Instant;
import java.util.List;

/**
 * Coredump files were found on a device.
 */
public record CrashDetectedEvent(String deviceId, List<String> coredumpFiles, Instant at) {

    public CrashDetectedEvent {
        coredumpFiles = List.copyOf(coredumpFiles);
    }
}
