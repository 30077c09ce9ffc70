package com.phillippitts.fleetdump.service.path;

import com.phillippitts.fleetdump.domain.TriggerReason;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Groups every device of a request under one issue directory:
 * {@code <root>/<prefix>/<timestamp>/<device>}.
 */
public final class UnifiedPathStrategy implements PathNamingStrategy {

    public static final String DEFAULT_PREFIX = "issues";

    private final Path root;
    private final String prefix;

    public UnifiedPathStrategy(Path root, String prefix) {
        this.root = Objects.requireNonNull(root, "root");
        this.prefix = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix;
    }

    @Override
    public Path resolve(String deviceId, String requestTimestamp, TriggerReason trigger) {
        return root.resolve(prefix).resolve(requestTimestamp).resolve(deviceId);
    }

    @Override
    public String name() {
        return PathStrategyType.UNIFIED.value();
    }
}
