package com.phillippitts.fleetdump.service.monitor;

import com.phillippitts.fleetdump.config.properties.CrashMonitorProperties;
import com.phillippitts.fleetdump.domain.TriggerReason;
import com.phillippitts.fleetdump.service.coordinator.event.FleetDumpCompletedEvent;
import com.phillippitts.fleetdump.service.coordinator.event.FleetDumpErrorEvent;
import com.phillippitts.fleetdump.service.coordinator.event.FleetDumpRequestedEvent;
import com.phillippitts.fleetdump.service.coordinator.event.FleetDumpStartedEvent;
import com.phillippitts.fleetdump.service.device.AttachedDeviceProvider;
import com.phillippitts.fleetdump.service.device.DeviceTransport;
import com.phillippitts.fleetdump.service.device.ShellResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Polls attached devices for new coredumps and requests a fleet dump when one appears.
 *
 * <p>Polling pauses from the moment a crash is reported until the resulting request completes or
 * fails to start, so one crash yields one request.
 */
@Component
@ConditionalOnProperty(prefix = "dump.crash-monitor", name = "enabled", havingValue = "true")
public class CrashMonitorService {

    private static final Logger LOG = LogManager.getLogger(CrashMonitorService.class);

    private final DeviceTransport transport;
    private final AttachedDeviceProvider deviceProvider;
    private final ApplicationEventPublisher publisher;
    private final CrashMonitorProperties properties;

    private volatile boolean paused;

    public CrashMonitorService(DeviceTransport transport,
                               AttachedDeviceProvider deviceProvider,
                               ApplicationEventPublisher publisher,
                               CrashMonitorProperties properties) {
        this.transport = transport;
        this.deviceProvider = deviceProvider;
        this.publisher = publisher;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${dump.crash-monitor.interval-ms:5000}",
            initialDelayString = "${dump.crash-monitor.interval-ms:5000}")
    public void poll() {
        if (paused) {
            LOG.debug("Crash monitor paused while a fleet dump is active");
            return;
        }
        String listCommand = "ls " + properties.getCoredumpPath();
        for (String deviceId : deviceProvider.attachedDevices()) {
            ShellResult result = transport.execute(deviceId, listCommand);
            if (!result.isOk()) {
                LOG.debug("Coredump check failed for {}: {}", deviceId, result.detail());
                continue;
            }
            List<String> coredumps = CoredumpListing.coredumpFiles(result.output());
            if (!coredumps.isEmpty()) {
                onCrash(deviceId, coredumps);
                return;
            }
        }
    }

    private void onCrash(String deviceId, List<String> coredumps) {
        LOG.warn("Coredump detected on {}: {}", deviceId, coredumps);
        paused = true;
        publisher.publishEvent(new CrashDetectedEvent(deviceId, coredumps, Instant.now()));
        publisher.publishEvent(new FleetDumpRequestedEvent(TriggerReason.CRASH_MONITOR, List.of(), null, deviceId));
    }

    @EventListener
    void onFleetDumpStarted(FleetDumpStartedEvent event) {
        paused = true;
    }

    @EventListener
    void onFleetDumpCompleted(FleetDumpCompletedEvent event) {
        paused = false;
    }

    @EventListener
    void onFleetDumpError(FleetDumpErrorEvent event) {
        paused = false;
    }

    public boolean isPaused() {
        return paused;
    }
}
