package com.phillippitts.fleetdump.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Typed properties for reaching attached devices over adb.
 */
@Validated
@ConfigurationProperties(prefix = "devices")
public class DeviceProperties {

    /** Serials of the devices considered attached; order is preserved. */
    private final List<String> serials;

    @NotBlank
    private final String adbBinary;

    @NotNull
    private final Duration commandTimeout;

    @ConstructorBinding
    public DeviceProperties(List<String> serials, String adbBinary, Duration commandTimeout) {
        this.serials = serials == null ? List.of()
                : serials.stream().map(String::trim).filter(s -> !s.isEmpty()).distinct().toList();
        this.adbBinary = adbBinary == null || adbBinary.isBlank() ? "adb" : adbBinary;
        this.commandTimeout = commandTimeout == null ? Duration.ofSeconds(30) : commandTimeout;
    }

    public List<String> getSerials() {
        return serials;
    }

    public String getAdbBinary() {
        return adbBinary;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }
}
