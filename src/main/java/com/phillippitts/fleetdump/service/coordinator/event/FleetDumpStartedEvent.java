package com.phillippitts.fleetdump.service.coordinator.event;

import com.phillippitts.fleetdump.domain.DumpMode;
import com.phillippitts.fleetdump.domain.TriggerReason;

import java.nio.file.Path;
import java.util.List;

/**
 * A fleet request was admitted and its manifest created.
 */
public record FleetDumpStartedEvent(String issueId,
                                    TriggerReason trigger,
                                    DumpMode mode,
                                    List<String> targets,
                                    Path issueRoot) {
}
