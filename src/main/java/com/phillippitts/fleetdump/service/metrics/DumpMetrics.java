package com.phillippitts.fleetdump.service.metrics;

import com.phillippitts.fleetdump.domain.DumpMode;
import com.phillippitts.fleetdump.domain.DumpOutcome;
import com.phillippitts.fleetdump.domain.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Centralized metrics tracking for fleet dumps.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Per-device outcomes by status and failure kind</li>
 *   <li>Per-device extraction duration by mode</li>
 *   <li>Completed fleet requests</li>
 *   <li>Upload results</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class DumpMetrics {

    private static final String METRIC_PREFIX = "fleetdump";

    private final MeterRegistry registry;

    public DumpMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a device's terminal outcome and how long it took.
     */
    public void recordOutcome(DumpOutcome outcome, DumpMode mode) {
        FailureKind kind = outcome.failureKind();
        Counter.builder(METRIC_PREFIX + ".device.outcome")
                .description("Terminal outcomes of device dump jobs")
                .tag("status", lower(outcome.status().name()))
                .tag("reason", kind == null ? "none" : lower(kind.name()))
                .register(registry)
                .increment();

        Timer.builder(METRIC_PREFIX + ".device.duration")
                .description("Wall time from job start to terminal outcome")
                .tag("mode", lower(mode.name()))
                .register(registry)
                .record(outcome.elapsed());
    }

    /**
     * Increments the completed-request counter, tagged by whether any device succeeded.
     */
    public void recordFleetCompleted(int successCount, int failCount) {
        String result = successCount == 0 ? "none" : failCount == 0 ? "all" : "partial";
        Counter.builder(METRIC_PREFIX + ".fleet.completed")
                .description("Completed fleet dump requests")
                .tag("succeeded", result)
                .register(registry)
                .increment();
    }

    public void recordUpload(boolean success) {
        Counter.builder(METRIC_PREFIX + ".upload")
                .description("Issue directory uploads")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
