package com.phillippitts.fleetdump.service.device;

import com.phillippitts.fleetdump.config.properties.DeviceProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads the attached fleet from {@code devices.serials}.
 */
@Component
public class ConfiguredDeviceProvider implements AttachedDeviceProvider {

    private final DeviceProperties properties;

    public ConfiguredDeviceProvider(DeviceProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<String> attachedDevices() {
        return properties.getSerials();
    }
}
