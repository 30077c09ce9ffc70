package com.phillippitts.fleetdump.service.path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Configured directory layouts. Unknown names fall back to {@link #UNIFIED}.
 */
public enum PathStrategyType {
    UNIFIED("unified"),
    INDIVIDUAL("individual"),
    HYBRID("hybrid");

    private static final Logger LOG = LogManager.getLogger(PathStrategyType.class);

    private final String value;

    PathStrategyType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static PathStrategyType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (PathStrategyType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        LOG.warn("Unknown path strategy '{}', using {}", name, UNIFIED.value);
        return UNIFIED;
    }

    /**
     * Builds the strategy rooted at {@code logDirectory}.
     *
     * @param prefix issue directory prefix used by the unified layout
     */
    public PathNamingStrategy create(Path logDirectory, String prefix) {
        UnifiedPathStrategy unified = new UnifiedPathStrategy(logDirectory, prefix);
        return switch (this) {
            case UNIFIED -> unified;
            case INDIVIDUAL -> new IndividualPathStrategy(logDirectory);
            case HYBRID -> new HybridPathStrategy(unified, new IndividualPathStrategy(logDirectory));
        };
    }
}
