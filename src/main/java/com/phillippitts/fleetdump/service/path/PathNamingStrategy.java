package com.phillippitts.fleetdump.service.path;

import com.phillippitts.fleetdump.domain.TriggerReason;

import java.nio.file.Path;

/**
 * Maps a device and request onto the directory its dump is written to.
 *
 * <p>Implementations are pure: the same inputs always give the same path and nothing is created
 * on disk. The coordinator uses the parent of the first device's path as the request's issue root.
 */
public interface PathNamingStrategy {

    /**
     * @param deviceId device serial
     * @param requestTimestamp request identifier ({@code yyMMdd-HHmmss})
     * @param trigger why the dump was requested
     * @return device dump directory
     */
    Path resolve(String deviceId, String requestTimestamp, TriggerReason trigger);

    /**
     * Name recorded in the manifest under {@code path_strategy}.
     */
    String name();
}
