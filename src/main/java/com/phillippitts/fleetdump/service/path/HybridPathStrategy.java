package com.phillippitts.fleetdump.service.path;

import com.phillippitts.fleetdump.domain.TriggerReason;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Unified layout for failed health checks (they are investigated as one fleet issue), individual
 * layout for everything else.
 */
public final class HybridPathStrategy implements PathNamingStrategy {

    private final PathNamingStrategy unified;
    private final PathNamingStrategy individual;

    public HybridPathStrategy(PathNamingStrategy unified, PathNamingStrategy individual) {
        this.unified = Objects.requireNonNull(unified, "unified");
        this.individual = Objects.requireNonNull(individual, "individual");
    }

    @Override
    public Path resolve(String deviceId, String requestTimestamp, TriggerReason trigger) {
        PathNamingStrategy delegate = trigger == TriggerReason.HEALTH_CHECK_FAILED ? unified : individual;
        return delegate.resolve(deviceId, requestTimestamp, trigger);
    }

    @Override
    public String name() {
        return PathStrategyType.HYBRID.value();
    }
}
