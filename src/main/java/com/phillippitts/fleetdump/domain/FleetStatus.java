package com.phillippitts.fleetdump.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable point-in-time view of the active fleet request, safe to hand to other threads.
 */
public record FleetStatus(String issueId,
                          TriggerReason trigger,
                          DumpMode mode,
                          String issueRoot,
                          List<String> targets,
                          int completed,
                          int inflight,
                          int queued,
                          int successCount,
                          int failCount,
                          int cancelledCount,
                          Map<String, DumpState> deviceStates,
                          Instant startedAt) {

    public FleetStatus {
        targets = List.copyOf(targets);
        deviceStates = Map.copyOf(deviceStates);
    }

    public int total() {
        return targets.size();
    }
}
