package com.phillippitts.fleetdump.service.device;

import java.util.List;

/**
 * Supplies the serials of the devices a fleet dump targets when the caller names none.
 */
@FunctionalInterface
public interface AttachedDeviceProvider {

    /**
     * Returns attached device serials in a stable order; empty when nothing is attached.
     */
    List<String> attachedDevices();
}
