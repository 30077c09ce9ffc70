package com.phillippitts.fleetdump.service.coordinator;

import com.phillippitts.fleetdump.domain.DumpMode;
import com.phillippitts.fleetdump.domain.DumpOutcome;
import com.phillippitts.fleetdump.domain.FailureKind;
import com.phillippitts.fleetdump.domain.FleetStatus;
import com.phillippitts.fleetdump.domain.TriggerReason;
import com.phillippitts.fleetdump.domain.UploadOutcome;
import com.phillippitts.fleetdump.exception.ManifestReadException;
import com.phillippitts.fleetdump.exception.ManifestWriteException;
import com.phillippitts.fleetdump.exception.UnknownDeviceException;
import com.phillippitts.fleetdump.service.coordinator.event.FleetDumpCompletedEvent;
import com.phillippitts.fleetdump.service.coordinator.event.FleetDumpErrorEvent;
import com.phillippitts.fleetdump.service.coordinator.event.FleetDumpProgressEvent;
import com.phillippitts.fleetdump.service.coordinator.event.FleetDumpRequestedEvent;
import com.phillippitts.fleetdump.service.coordinator.event.FleetDumpStartedEvent;
import com.phillippitts.fleetdump.service.coordinator.event.UploadCompletedEvent;
import com.phillippitts.fleetdump.service.coordinator.event.UploadConfirmationRequestedEvent;
import com.phillippitts.fleetdump.service.device.AttachedDeviceProvider;
import com.phillippitts.fleetdump.service.dump.DumpJob;
import com.phillippitts.fleetdump.service.dump.DumpJobFactory;
import com.phillippitts.fleetdump.service.manifest.ManifestStore;
import com.phillippitts.fleetdump.service.metrics.DumpMetrics;
import com.phillippitts.fleetdump.service.path.PathNamingStrategy;
import com.phillippitts.fleetdump.service.upload.UploadPipeline;
import com.phillippitts.fleetdump.service.upload.UploadResult;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Runs one fleet-wide dump request at a time across the attached devices.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Admit a request, name its issue directory and write the initial manifest</li>
 *   <li>Start at most {@code maxConcurrency} device jobs and back-fill as they finish</li>
 *   <li>Record each device's outcome exactly once and keep the manifest current</li>
 *   <li>Decide on, and run or stage, the upload once every device is done</li>
 * </ul>
 *
 * <p><b>Concurrency model:</b> every mutation of fleet state runs as a command on a
 * {@link SerialCommandLoop}. Job outcomes, operator actions and new requests are all queued onto
 * the same loop, so the bookkeeping needs no locks and outcomes arriving together cannot race.
 * Readers on other threads see an immutable {@link FleetStatus} snapshot.
 */
@Service
public class FleetDumpCoordinator {

    private static final Logger LOG = LogManager.getLogger(FleetDumpCoordinator.class);

    static final DateTimeFormatter ISSUE_ID_FORMAT = DateTimeFormatter.ofPattern("yyMMdd-HHmmss");
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private record PendingUpload(String issueId, Path issueRoot, String remotePath, TriggerReason trigger) {}

    private final DumpJobFactory jobFactory;
    private final PathNamingStrategy pathStrategy;
    private final ManifestStore manifestStore;
    private final UploadPipeline uploadPipeline;
    private final AttachedDeviceProvider deviceProvider;
    private final DumpMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final SerialCommandLoop loop;
    private final Executor uploadExecutor;
    private final Clock clock;

    // Confined to the command loop
    private CoordinatorSettings settings;
    private FleetRequest active;
    private final Map<String, PendingUpload> pendingUploads = new HashMap<>();

    private volatile FleetStatus status;

    public FleetDumpCoordinator(DumpJobFactory jobFactory,
                                PathNamingStrategy pathStrategy,
                                ManifestStore manifestStore,
                                UploadPipeline uploadPipeline,
                                AttachedDeviceProvider deviceProvider,
                                DumpMetrics metrics,
                                ApplicationEventPublisher publisher,
                                CoordinatorSettings settings,
                                @Qualifier("coordinatorExecutor") Executor coordinatorExecutor,
                                @Qualifier("uploadExecutor") Executor uploadExecutor,
                                Clock clock) {
        this.jobFactory = Objects.requireNonNull(jobFactory, "jobFactory");
        this.pathStrategy = Objects.requireNonNull(pathStrategy, "pathStrategy");
        this.manifestStore = Objects.requireNonNull(manifestStore, "manifestStore");
        this.uploadPipeline = Objects.requireNonNull(uploadPipeline, "uploadPipeline");
        this.deviceProvider = Objects.requireNonNull(deviceProvider, "deviceProvider");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.loop = new SerialCommandLoop(Objects.requireNonNull(coordinatorExecutor, "coordinatorExecutor"));
        this.uploadExecutor = Objects.requireNonNull(uploadExecutor, "uploadExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Requests a fleet dump.
     *
     * <p>Ignored (rejected) while another request is in progress. When {@code deviceIds} is empty
     * every attached device is targeted; with no devices at all a {@link FleetDumpErrorEvent} is
     * published and nothing starts.
     *
     * @return admission decision, completed once the request has been admitted or rejected
     */
    public CompletableFuture<RequestAdmission> request(TriggerReason trigger,
                                                       Collection<String> deviceIds,
                                                       DumpRequestOptions options) {
        Objects.requireNonNull(trigger, "trigger");
        List<String> requested = deviceIds == null ? List.of() : List.copyOf(deviceIds);
        DumpRequestOptions opts = options == null ? DumpRequestOptions.defaults() : options;
        return loop.call(() -> admit(trigger, requested, opts));
    }

    @EventListener
    public void onFleetDumpRequested(FleetDumpRequestedEvent event) {
        request(event.trigger(), event.deviceIds(),
                new DumpRequestOptions(event.uploadEnabled(), event.requestDeviceId()));
    }

    /**
     * First stage of an operator cancellation for one device.
     *
     * @return false if the job cannot be cancelled right now (headless, already requested, not extracting)
     * @throws UnknownDeviceException (via the future) if the device has no running job
     */
    public CompletableFuture<Boolean> requestCancel(String deviceId) {
        return loop.call(() -> runningJob(deviceId).requestCancel());
    }

    public CompletableFuture<Boolean> confirmCancel(String deviceId, boolean cleanupTarget) {
        return loop.call(() -> runningJob(deviceId).confirmCancel(cleanupTarget));
    }

    public CompletableFuture<Boolean> withdrawCancel(String deviceId) {
        return loop.call(() -> runningJob(deviceId).withdrawCancel());
    }

    /**
     * Starts a staged upload for a manually triggered request.
     *
     * @return false if no upload is waiting for {@code issueId}
     */
    public CompletableFuture<Boolean> confirmUpload(String issueId) {
        return loop.call(() -> {
            PendingUpload upload = pendingUploads.remove(issueId);
            if (upload == null) {
                return false;
            }
            LOG.info("Upload confirmed for {}", issueId);
            startUpload(upload);
            return true;
        });
    }

    /**
     * Declines a staged upload; the manifest records the decline.
     *
     * @return false if no upload is waiting for {@code issueId}
     */
    public CompletableFuture<Boolean> declineUpload(String issueId) {
        return loop.call(() -> {
            PendingUpload upload = pendingUploads.remove(issueId);
            if (upload == null) {
                return false;
            }
            LOG.info("Upload declined for {}", issueId);
            recordUpload(upload, UploadOutcome.declined(issueId, clock.instant()));
            return true;
        });
    }

    /**
     * Replaces the runtime settings. A lower concurrency limit never stops running jobs; it only
     * delays back-fill until the running count drops below it.
     */
    public CompletableFuture<CoordinatorSettings> updateSettings(CoordinatorSettings updated) {
        Objects.requireNonNull(updated, "updated");
        return loop.call(() -> {
            LOG.info("Coordinator settings updated: {}", updated);
            this.settings = updated;
            launchAvailable();
            return updated;
        });
    }

    public CompletableFuture<CoordinatorSettings> currentSettings() {
        return loop.call(() -> settings);
    }

    /**
     * Snapshot of the active request, or empty when idle.
     */
    public Optional<FleetStatus> activeStatus() {
        return Optional.ofNullable(status);
    }

    public boolean isBusy() {
        return status != null;
    }

    /**
     * Kills any running extraction. Their outcomes are recorded as process failures.
     */
    @PreDestroy
    public void shutdown() {
        try {
            Integer count = loop.call(() -> {
                if (active == null) {
                    return 0;
                }
                List<DumpJob> jobs = active.runningJobs();
                jobs.forEach(DumpJob::abort);
                return jobs.size();
            }).get(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            if (count > 0) {
                LOG.warn("Aborted {} running dump job(s) on shutdown", count);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            LOG.warn("Coordinator shutdown did not complete cleanly: {}", e.toString());
        }
    }

    private RequestAdmission admit(TriggerReason trigger, List<String> requested, DumpRequestOptions options) {
        if (active != null) {
            LOG.warn("Another fleet dump is in progress (issueId={}); ignoring {} request",
                    active.issueId(), trigger.value());
            return RequestAdmission.rejected(RequestAdmission.Rejection.BUSY, active.issueId());
        }

        List<String> devices = new ArrayList<>(new LinkedHashSet<>(
                requested.isEmpty() ? deviceProvider.attachedDevices() : requested));
        if (devices.isEmpty()) {
            LOG.warn("No active devices to dump ({} request)", trigger.value());
            publisher.publishEvent(new FleetDumpErrorEvent(null, "no-devices",
                    "No active devices to dump", clock.instant()));
            return RequestAdmission.rejected(RequestAdmission.Rejection.NO_DEVICES, null);
        }

        Instant now = clock.instant();
        String issueId = ISSUE_ID_FORMAT.withZone(clock.getZone()).format(now);
        Map<String, Path> directories = new LinkedHashMap<>();
        for (String device : devices) {
            directories.put(device, pathStrategy.resolve(device, issueId, trigger));
        }
        Path issueRoot = directories.get(devices.get(0)).getParent();
        try {
            Files.createDirectories(issueRoot);
        } catch (IOException e) {
            LOG.error("Cannot create issue directory {}: {}", issueRoot, e.toString());
            publisher.publishEvent(new FleetDumpErrorEvent(issueId, "issue-dir",
                    "Cannot create issue directory " + issueRoot + ": " + e.getMessage(), clock.instant()));
            return RequestAdmission.rejected(RequestAdmission.Rejection.ISSUE_DIRECTORY, null);
        }

        DumpMode mode = settings.modeFor(trigger);
        FleetRequest request = new FleetRequest(issueId, trigger, mode, directories, issueRoot,
                options.uploadEnabled(), options.requestDeviceId(), pathStrategy.name(), now);
        active = request;
        ThreadContext.put("issueId", issueId);
        try {
            LOG.info("Fleet dump {} started: trigger={}, mode={}, targets={}, issueRoot={}",
                    issueId, trigger.value(), mode, devices, issueRoot);
            persist(request);
            publisher.publishEvent(new FleetDumpStartedEvent(issueId, trigger, mode, request.targets(), issueRoot));
            launchAvailable();
        } finally {
            ThreadContext.remove("issueId");
        }
        return RequestAdmission.accepted(issueId, issueRoot.toString(), request.targets());
    }

    private void launchAvailable() {
        FleetRequest request = active;
        while (request != null && request == active && request.hasPending()
                && request.inflight() < settings.maxConcurrency()) {
            String deviceId = request.nextPending();
            Path directory = request.directoryFor(deviceId);
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                LOG.warn("Cannot create dump directory for {}: {}", deviceId, e.toString());
                apply(request, DumpOutcome.failed(deviceId, FailureKind.SETUP,
                        "Failed to create dump directory " + directory + ": " + e.getMessage(), null, Duration.ZERO));
                continue;
            }

            DumpJob job = jobFactory.create(deviceId);
            request.markRunning(deviceId, job);
            String issueId = request.issueId();
            LOG.info("Starting dump for {} ({} running, {} queued)", deviceId, request.inflight(),
                    request.targets().size() - request.completedCount() - request.inflight());
            job.start(request.trigger(), request.mode(), directory,
                    outcome -> loop.execute(() -> onOutcome(issueId, outcome)));
        }
        publishStatus();
    }

    private void onOutcome(String issueId, DumpOutcome outcome) {
        FleetRequest request = active;
        if (request == null || !request.issueId().equals(issueId)) {
            LOG.debug("Ignoring outcome for {} from finished request {}", outcome.deviceId(), issueId);
            return;
        }
        ThreadContext.put("issueId", issueId);
        try {
            apply(request, outcome);
            if (active == request) {
                launchAvailable();
            }
        } finally {
            ThreadContext.remove("issueId");
        }
    }

    /**
     * Records one outcome; completes the request when it was the last one.
     */
    private void apply(FleetRequest request, DumpOutcome outcome) {
        if (!request.record(outcome)) {
            LOG.debug("Ignoring duplicate or foreign outcome for {} in {}", outcome.deviceId(), request.issueId());
            return;
        }
        LOG.info("Dump for {} finished: {} - {} ({}/{})", outcome.deviceId(), outcome.status(),
                outcome.detail(), request.completedCount(), request.targets().size());
        metrics.recordOutcome(outcome, request.mode());
        persist(request);
        publisher.publishEvent(new FleetDumpProgressEvent(request.issueId(), outcome.deviceId(),
                request.completedCount(), request.targets().size()));
        if (request.isFinished()) {
            complete(request);
        }
    }

    private void complete(FleetRequest request) {
        LOG.info("Fleet dump {} completed: success={}, failed={}, cancelled={}", request.issueId(),
                request.successCount(), request.failCount(), request.cancelledCount());
        metrics.recordFleetCompleted(request.successCount(), request.failCount());
        publisher.publishEvent(new FleetDumpCompletedEvent(request.issueId(), request.successCount(),
                request.failCount(), request.cancelledCount(), request.issueRoot()));
        try {
            dispatchUpload(request);
        } finally {
            active = null;
            publishStatus();
        }
    }

    private void dispatchUpload(FleetRequest request) {
        if (request.successCount() == 0) {
            LOG.info("No successful dumps in {}; skipping upload", request.issueId());
            return;
        }
        boolean enabled = request.uploadEnabled() != null ? request.uploadEnabled() : settings.autoUploadEnabled();
        if (!enabled) {
            LOG.info("Upload disabled for {}", request.issueId());
            return;
        }

        PendingUpload upload = new PendingUpload(request.issueId(), request.issueRoot(),
                settings.remotePathFor(request.issueId()), request.trigger());
        if (request.trigger().isAutomated()) {
            startUpload(upload);
        } else {
            pendingUploads.put(upload.issueId(), upload);
            LOG.info("Upload for {} awaiting operator confirmation", upload.issueId());
            publisher.publishEvent(new UploadConfirmationRequestedEvent(upload.issueId(), upload.issueRoot(),
                    upload.remotePath(), request.targets(), request.successCount()));
        }
    }

    private void startUpload(PendingUpload upload) {
        LOG.info("Uploading {} to {}", upload.issueRoot(), upload.remotePath());
        try {
            uploadExecutor.execute(() -> {
                UploadOutcome outcome = performUpload(upload);
                loop.execute(() -> recordUpload(upload, outcome));
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Upload queue full; upload for {} not started", upload.issueId());
            recordUpload(upload, new UploadOutcome(upload.issueId(), false, "Upload queue full",
                    List.of(), Map.of(), clock.instant()));
        }
    }

    private UploadOutcome performUpload(PendingUpload upload) {
        List<String> files = listFiles(upload.issueRoot());
        try {
            UploadResult result = uploadPipeline.uploadDirectory(upload.issueRoot(), upload.remotePath());
            return new UploadOutcome(upload.issueId(), result.success(), result.message(), files,
                    result.data(), clock.instant());
        } catch (RuntimeException e) {
            LOG.error("Upload for {} failed unexpectedly", upload.issueId(), e);
            return new UploadOutcome(upload.issueId(), false, "Upload error: " + e.getMessage(), files,
                    Map.of(), clock.instant());
        }
    }

    private void recordUpload(PendingUpload upload, UploadOutcome outcome) {
        metrics.recordUpload(outcome.success());
        try {
            manifestStore.recordUploadResult(upload.issueRoot(), outcome);
        } catch (ManifestWriteException | ManifestReadException e) {
            LOG.warn("Could not record upload result for {}: {}", upload.issueId(), e.getMessage());
        }
        if (outcome.success()) {
            LOG.info("Upload for {} succeeded: {}", upload.issueId(), outcome.message());
        } else {
            LOG.warn("Upload for {} did not complete: {}", upload.issueId(), outcome.message());
        }
        publisher.publishEvent(new UploadCompletedEvent(outcome, upload.issueRoot()));
    }

    private void persist(FleetRequest request) {
        try {
            manifestStore.write(request.issueRoot(), request.toManifest());
        } catch (ManifestWriteException e) {
            LOG.warn("{} (continuing without manifest update)", e.getMessage());
        }
    }

    private DumpJob runningJob(String deviceId) {
        if (active == null) {
            throw new UnknownDeviceException(deviceId);
        }
        return active.runningJob(deviceId).orElseThrow(() -> new UnknownDeviceException(deviceId));
    }

    private void publishStatus() {
        FleetRequest request = active;
        status = request == null ? null : request.snapshot();
    }

    private static List<String> listFiles(Path issueRoot) {
        try (Stream<Path> walk = Files.walk(issueRoot)) {
            return walk.filter(Files::isRegularFile)
                    .map(p -> issueRoot.relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            LOG.warn("Could not list files under {}: {}", issueRoot, e.toString());
            return List.of();
        }
    }
}
