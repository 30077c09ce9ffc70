package com.phillippitts.fleetdump.service.coordinator;

import com.phillippitts.fleetdump.domain.DeviceResult;
import com.phillippitts.fleetdump.domain.DumpMode;
import com.phillippitts.fleetdump.domain.DumpOutcome;
import com.phillippitts.fleetdump.domain.DumpState;
import com.phillippitts.fleetdump.domain.FleetStatus;
import com.phillippitts.fleetdump.domain.Manifest;
import com.phillippitts.fleetdump.domain.TriggerReason;
import com.phillippitts.fleetdump.service.dump.DumpJob;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable bookkeeping for the one active fleet request.
 *
 * <p>Not thread-safe: only the coordinator's command loop touches it. Invariants kept here:
 * {@code completed ⊆ targets}, {@code success + fail + cancelled == completed.size()}, and a
 * device is pending, running or completed, never two at once.
 */
final class FleetRequest {

    private final String issueId;
    private final TriggerReason trigger;
    private final DumpMode mode;
    private final List<String> targets;
    private final Map<String, Path> deviceDirectories;
    private final Path issueRoot;
    private final Boolean uploadEnabled;
    private final String requestDeviceId;
    private final String pathStrategy;
    private final Instant createdAt;

    private final Deque<String> pending;
    private final Map<String, DumpJob> running = new LinkedHashMap<>();
    private final Set<String> completed = new LinkedHashSet<>();
    private final Map<String, DeviceResult> results = new LinkedHashMap<>();
    private int successCount;
    private int failCount;
    private int cancelledCount;

    FleetRequest(String issueId,
                 TriggerReason trigger,
                 DumpMode mode,
                 Map<String, Path> deviceDirectories,
                 Path issueRoot,
                 Boolean uploadEnabled,
                 String requestDeviceId,
                 String pathStrategy,
                 Instant createdAt) {
        if (deviceDirectories.isEmpty()) {
            throw new IllegalArgumentException("a fleet request needs at least one target");
        }
        this.issueId = issueId;
        this.trigger = trigger;
        this.mode = mode;
        this.deviceDirectories = Collections.unmodifiableMap(new LinkedHashMap<>(deviceDirectories));
        this.targets = List.copyOf(deviceDirectories.keySet());
        this.issueRoot = issueRoot;
        this.uploadEnabled = uploadEnabled;
        this.requestDeviceId = requestDeviceId;
        this.pathStrategy = pathStrategy;
        this.createdAt = createdAt;
        this.pending = new ArrayDeque<>(targets);
    }

    String issueId() {
        return issueId;
    }

    TriggerReason trigger() {
        return trigger;
    }

    DumpMode mode() {
        return mode;
    }

    List<String> targets() {
        return targets;
    }

    Path issueRoot() {
        return issueRoot;
    }

    Boolean uploadEnabled() {
        return uploadEnabled;
    }

    Path directoryFor(String deviceId) {
        return deviceDirectories.get(deviceId);
    }

    boolean isTarget(String deviceId) {
        return deviceDirectories.containsKey(deviceId);
    }

    boolean hasPending() {
        return !pending.isEmpty();
    }

    String nextPending() {
        return pending.pollFirst();
    }

    int inflight() {
        return running.size();
    }

    void markRunning(String deviceId, DumpJob job) {
        running.put(deviceId, job);
    }

    Optional<DumpJob> runningJob(String deviceId) {
        return Optional.ofNullable(running.get(deviceId));
    }

    List<DumpJob> runningJobs() {
        return List.copyOf(running.values());
    }

    boolean isCompleted(String deviceId) {
        return completed.contains(deviceId);
    }

    /**
     * Records a device's terminal outcome and frees its slot if it held one.
     *
     * @return false if the device is not a target or already has a result
     */
    boolean record(DumpOutcome outcome) {
        String deviceId = outcome.deviceId();
        if (!isTarget(deviceId) || completed.contains(deviceId)) {
            return false;
        }
        running.remove(deviceId);
        pending.remove(deviceId);
        completed.add(deviceId);
        results.put(deviceId, DeviceResult.from(outcome));
        switch (outcome.status()) {
            case SUCCESS -> successCount++;
            case FAILED -> failCount++;
            case CANCELLED -> cancelledCount++;
        }
        return true;
    }

    int completedCount() {
        return completed.size();
    }

    boolean isFinished() {
        return completed.size() == targets.size();
    }

    int successCount() {
        return successCount;
    }

    int failCount() {
        return failCount;
    }

    int cancelledCount() {
        return cancelledCount;
    }

    Manifest toManifest() {
        return new Manifest(issueId, trigger.value(), pathStrategy, requestDeviceId, targets, results,
                successCount, failCount, cancelledCount, issueRoot.toString(), uploadEnabled, createdAt,
                null, false);
    }

    FleetStatus snapshot() {
        Map<String, DumpState> states = new LinkedHashMap<>();
        for (String target : targets) {
            DumpJob job = running.get(target);
            states.put(target, job != null ? job.state() : DumpState.IDLE);
        }
        return new FleetStatus(issueId, trigger, mode, issueRoot.toString(), targets, completed.size(),
                running.size(), pending.size(), successCount, failCount, cancelledCount, states, createdAt);
    }
}
