package com.phillippitts.fleetdump.service.health;

import com.phillippitts.fleetdump.domain.FleetStatus;
import com.phillippitts.fleetdump.service.coordinator.FleetDumpCoordinator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reports the coordinator's activity under {@code /actuator/health} as {@code fleetDump}.
 *
 * <p>Always UP; the details show whether a request is running and how far it got.
 */
@Component("fleetDump")
public class FleetDumpHealthIndicator implements HealthIndicator {

    private final FleetDumpCoordinator coordinator;

    public FleetDumpHealthIndicator(FleetDumpCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        Optional<FleetStatus> active = coordinator.activeStatus();
        if (active.isEmpty()) {
            return Health.up().withDetail("state", "idle").build();
        }
        FleetStatus s = active.get();
        return Health.up()
                .withDetail("state", "dumping")
                .withDetail("issueId", s.issueId())
                .withDetail("trigger", s.trigger().value())
                .withDetail("completed", s.completed() + "/" + s.total())
                .withDetail("inflight", s.inflight())
                .withDetail("queued", s.queued())
                .withDetail("failed", s.failCount())
                .build();
    }
}
