package com.phillippitts.fleetdump.service.dump.event;

import com.phillippitts.fleetdump.domain.DumpState;
import com.phillippitts.fleetdump.domain.TriggerReason;

import java.time.Instant;

/**
 * Published on every state transition of a dump job.
 *
 * @param deviceId device the job runs against
 * @param previous state before the transition
 * @param current state after the transition
 * @param trigger trigger of the request the job belongs to
 * @param at wall-clock time of the transition
 */
public record DumpStatusChangedEvent(String deviceId,
                                     DumpState previous,
                                     DumpState current,
                                     TriggerReason trigger,
                                     Instant at) {
}
