package com.phillippitts.fleetdump.service.path;

import com.phillippitts.fleetdump.domain.TriggerReason;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One long-lived directory per device, shared by all requests: {@code <root>/dumps/<device>}.
 */
public final class IndividualPathStrategy implements PathNamingStrategy {

    static final String DUMPS_DIRECTORY = "dumps";

    private final Path root;

    public IndividualPathStrategy(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    @Override
    public Path resolve(String deviceId, String requestTimestamp, TriggerReason trigger) {
        return root.resolve(DUMPS_DIRECTORY).resolve(deviceId);
    }

    @Override
    public String name() {
        return PathStrategyType.INDIVIDUAL.value();
    }
}
