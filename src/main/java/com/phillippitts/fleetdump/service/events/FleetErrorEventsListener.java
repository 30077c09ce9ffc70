package com.phillippitts.fleetdump.service.events;

import com.phillippitts.fleetdump.service.coordinator.event.FleetDumpErrorEvent;
import com.phillippitts.fleetdump.service.coordinator.event.UploadCompletedEvent;
import com.phillippitts.fleetdump.service.dump.event.DumpCompletionNoticeEvent;
import com.phillippitts.fleetdump.service.monitor.CrashDetectedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operator-facing failure events. Throttled per reason to avoid log spam
 * when the crash monitor or a broken upload tool keeps failing.
 */
@Component
class FleetErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(FleetErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onFleetDumpError(FleetDumpErrorEvent e) {
        if (shouldLog("fleet-" + e.reason())) {
            LOG.warn("Fleet dump not started: reason={}, {}. Check attached devices and dump.log-directory.",
                    e.reason(), e.message());
        }
    }

    @EventListener
    void onUploadCompleted(UploadCompletedEvent e) {
        if (e.outcome().success() || e.outcome().isDeclined()) {
            return;
        }
        if (shouldLog("upload-failed")) {
            LOG.warn("Upload of {} failed: {}. Check the JFrog CLI installation and dump.upload.* properties.",
                    e.issueRoot(), e.outcome().message());
        }
    }

    @EventListener
    void onDumpCompletionNotice(DumpCompletionNoticeEvent e) {
        if (!e.success() && shouldLog("dump-failed-" + e.deviceId())) {
            LOG.warn("Dump failed on {}: {}", e.deviceId(), e.message());
        }
    }

    @EventListener
    void onCrashDetected(CrashDetectedEvent e) {
        if (shouldLog("crash-" + e.deviceId())) {
            LOG.warn("Crash detected on {}: {} coredump file(s)", e.deviceId(), e.coredumpFiles().size());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
