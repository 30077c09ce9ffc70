package com.phillippitts.fleetdump.service.dump;

import com.phillippitts.fleetdump.domain.DumpMode;
import com.phillippitts.fleetdump.domain.DumpOutcome;
import com.phillippitts.fleetdump.domain.DumpState;
import com.phillippitts.fleetdump.domain.FailureKind;
import com.phillippitts.fleetdump.domain.OutcomeStatus;
import com.phillippitts.fleetdump.domain.TriggerReason;
import com.phillippitts.fleetdump.exception.DumpExceptionBuilder;
import com.phillippitts.fleetdump.exception.DumpProcessException;
import com.phillippitts.fleetdump.exception.DumpSetupException;
import com.phillippitts.fleetdump.exception.DumpTimeoutException;
import com.phillippitts.fleetdump.exception.DumpVerificationException;
import com.phillippitts.fleetdump.service.device.DeviceTransport;
import com.phillippitts.fleetdump.service.device.ShellResult;
import com.phillippitts.fleetdump.service.dump.event.DumpCompletionNoticeEvent;
import com.phillippitts.fleetdump.service.dump.event.DumpProgressEvent;
import com.phillippitts.fleetdump.service.dump.event.DumpStatusChangedEvent;
import com.phillippitts.fleetdump.service.process.ProcessFactory;
import com.phillippitts.fleetdump.service.process.ProcessOutput;
import com.phillippitts.fleetdump.service.process.ProcessTermination;
import com.phillippitts.fleetdump.util.LogSanitizer;
import com.phillippitts.fleetdump.util.ProcessTimeouts;
import com.phillippitts.fleetdump.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Runs the extraction script for one device and reports exactly one {@link DumpOutcome}.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → STARTING → EXTRACTING → VERIFYING → COMPLETED
 *                 ↘ FAILED     ↘ FAILED     ↘ FAILED
 *                              ↘ TIMEOUT
 *                              ↘ IDLE (confirmed cancellation)
 * COMPLETED | FAILED | TIMEOUT → IDLE (after the outcome is reported)
 * </pre>
 *
 * <p>{@link #start} validates the working directory and launches the script on the calling
 * thread, then hands supervision to the job executor. The supervision loop waits for the process
 * in {@code progressInterval} slices so that it can emit headless progress, notice an expired
 * deadline and honour a confirmed cancellation without a separate timer thread.
 *
 * <p>Cancellation is two-stage and only offered in {@link DumpMode#INTERACTIVE} mode:
 * {@link #requestCancel()} asks, {@link #confirmCancel(boolean)} sends a terminate signal, and the
 * supervision loop force-kills the process if it is still alive after the grace period. The
 * outcome is reported only once the process has actually gone.
 *
 * <p><b>Thread Safety:</b> state is guarded by a {@link ReentrantLock}; events are published
 * outside the lock.
 */
public final class DumpJob {

    private static final Logger LOG = LogManager.getLogger(DumpJob.class);

    static final String SERIAL_ENV = "ADB_SERIAL";
    private static final int OUTPUT_WINDOW_CHARS = 16 * 1024;
    private static final int ERROR_SNIPPET_MAX_CHARS = 400;

    private enum CancelStage { NONE, REQUESTED, CONFIRMED }

    private record Termination(DumpState state, DumpOutcome outcome) {}

    private final String deviceId;
    private final DumpJobSettings settings;
    private final ProcessFactory processFactory;
    private final DeviceTransport transport;
    private final Executor supervisorExecutor;
    private final ApplicationEventPublisher publisher;
    private final DumpArtifactVerifier verifier;
    private final LongSupplier nanoClock;

    private final Lock lock = new ReentrantLock();
    private DumpState state = DumpState.IDLE;
    private TriggerReason trigger;
    private DumpMode mode;
    private Path workingDirectory;
    private Process process;
    private ProcessOutput output;
    private ExtractionDeadline deadline;
    private Consumer<DumpOutcome> outcomeListener;
    private long startNanos;
    private CancelStage cancelStage = CancelStage.NONE;
    private boolean cleanupAfterCancel;
    private long cancelConfirmedNanos;

    DumpJob(String deviceId,
            DumpJobSettings settings,
            ProcessFactory processFactory,
            DeviceTransport transport,
            Executor supervisorExecutor,
            ApplicationEventPublisher publisher,
            LongSupplier nanoClock) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.supervisorExecutor = Objects.requireNonNull(supervisorExecutor, "supervisorExecutor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.verifier = new DumpArtifactVerifier(settings.requiredItems());
    }

    /**
     * Starts an extraction into {@code workingDirectory}.
     *
     * <p>Setup and launch failures are not thrown; they are reported through the listener as a
     * failed outcome before this method returns.
     *
     * @param trigger why the dump was requested
     * @param mode interactive or headless
     * @param workingDirectory device directory the script writes into
     * @param outcomeListener receives the single terminal outcome
     * @return {@code false} if the job was not idle (nothing happens, no outcome is reported)
     */
    public boolean start(TriggerReason trigger, DumpMode mode, Path workingDirectory,
                         Consumer<DumpOutcome> outcomeListener) {
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(outcomeListener, "outcomeListener");

        lock.lock();
        try {
            if (state != DumpState.IDLE) {
                LOG.warn("Dump already in progress for {} (state={})", deviceId, state);
                return false;
            }
            this.state = DumpState.STARTING;
            this.trigger = trigger;
            this.mode = mode;
            this.workingDirectory = workingDirectory;
            this.outcomeListener = outcomeListener;
            this.cancelStage = CancelStage.NONE;
            this.cleanupAfterCancel = false;
            this.startNanos = nanoClock.getAsLong();
        } finally {
            lock.unlock();
        }
        publishTransition(DumpState.IDLE, DumpState.STARTING, trigger);
        publishProgress("Starting dump (" + mode.name().toLowerCase(Locale.ROOT) + ")");

        try {
            prepareWorkingDirectory(workingDirectory);
            launch(mode, workingDirectory);
        } catch (DumpSetupException e) {
            LOG.warn("Dump setup failed: {}", e.getMessage());
            finish(new Termination(DumpState.FAILED, failure(FailureKind.SETUP, e.getMessage())));
        } catch (DumpProcessException e) {
            LOG.warn("Dump launch failed for {}: {}", deviceId, e.getMessage());
            finish(new Termination(DumpState.FAILED, failure(FailureKind.PROCESS, e.getMessage())));
        }
        return true;
    }

    /**
     * First stage of an operator cancellation. The extraction keeps running.
     *
     * @return {@code false} unless the job is extracting in interactive mode with no pending request
     */
    public boolean requestCancel() {
        lock.lock();
        try {
            if (state != DumpState.EXTRACTING || mode != DumpMode.INTERACTIVE
                    || cancelStage != CancelStage.NONE) {
                return false;
            }
            cancelStage = CancelStage.REQUESTED;
        } finally {
            lock.unlock();
        }
        LOG.info("Cancellation requested for {}; awaiting confirmation", deviceId);
        publishProgress("Cancellation requested - confirm to stop the extraction");
        return true;
    }

    /**
     * Withdraws a pending (unconfirmed) cancellation request.
     */
    public boolean withdrawCancel() {
        lock.lock();
        try {
            if (cancelStage != CancelStage.REQUESTED) {
                return false;
            }
            cancelStage = CancelStage.NONE;
        } finally {
            lock.unlock();
        }
        publishProgress("Cancellation withdrawn - extraction continues");
        return true;
    }

    /**
     * Second stage of an operator cancellation: sends a terminate signal to the script.
     *
     * @param cleanupTarget run the configured device cleanup commands once the process is gone
     * @return {@code false} if no cancellation was requested or the job already left EXTRACTING
     */
    public boolean confirmCancel(boolean cleanupTarget) {
        Process target;
        lock.lock();
        try {
            if (state != DumpState.EXTRACTING || cancelStage != CancelStage.REQUESTED) {
                return false;
            }
            cancelStage = CancelStage.CONFIRMED;
            cleanupAfterCancel = cleanupTarget;
            cancelConfirmedNanos = nanoClock.getAsLong();
            target = process;
        } finally {
            lock.unlock();
        }
        LOG.info("Cancelling dump for {} (cleanup={})", deviceId, cleanupTarget);
        publishProgress("Cancelling...");
        target.destroy();
        return true;
    }

    /**
     * Force-kills a running extraction. Used on shutdown; the job then reports a process failure.
     */
    public void abort() {
        Process target;
        lock.lock();
        try {
            target = process;
        } finally {
            lock.unlock();
        }
        if (target != null && target.isAlive()) {
            LOG.warn("Aborting dump for {}", deviceId);
            ProcessTermination.kill(target);
        }
    }

    public String deviceId() {
        return deviceId;
    }

    public DumpState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns true while an operator cancellation is pending confirmation.
     */
    public boolean isCancelRequested() {
        lock.lock();
        try {
            return cancelStage == CancelStage.REQUESTED;
        } finally {
            lock.unlock();
        }
    }

    // Package-private for tests
    boolean isDeadlineArmed() {
        lock.lock();
        try {
            return deadline != null && deadline.isArmed();
        } finally {
            lock.unlock();
        }
    }

    private void prepareWorkingDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new DumpSetupException("Failed to create dump directory " + dir + ": " + e, deviceId, e);
        }
        if (!Files.isRegularFile(settings.scriptPath())) {
            throw new DumpSetupException("Dump script not found: " + settings.scriptPath(), deviceId);
        }
    }

    private void launch(DumpMode mode, Path dir) {
        Process started;
        try {
            started = processFactory.start(List.of(settings.scriptPath().toString()), dir,
                    Map.of(SERIAL_ENV, deviceId));
        } catch (IOException e) {
            throw DumpExceptionBuilder.create("Failed to start dump process")
                    .device(deviceId)
                    .cause(e)
                    .metadata("script", settings.scriptPath())
                    .metadata("error", e.getMessage())
                    .build();
        }

        ProcessOutput collected = ProcessOutput.collect(started.getInputStream(), "dump-out-" + deviceId,
                OUTPUT_WINDOW_CHARS, line -> LOG.debug("[{}] {}", deviceId, line));
        ExtractionDeadline armed = ExtractionDeadline.arm(settings.timeoutFor(mode), nanoClock);
        lock.lock();
        try {
            this.process = started;
            this.output = collected;
            this.deadline = armed;
        } finally {
            lock.unlock();
        }
        transition(DumpState.EXTRACTING);
        long pid = pidOf(started);
        LOG.info("Dump started for {} (pid={}, mode={}, timeout={}s)", deviceId, pid, mode,
                armed.timeout().toSeconds());
        publishProgress("Extracting dump... (PID: " + pid + ")");

        try {
            supervisorExecutor.execute(this::supervise);
        } catch (RejectedExecutionException e) {
            armed.disarm();
            ProcessTermination.kill(started);
            throw DumpExceptionBuilder.create("No supervisor thread available for dump")
                    .device(deviceId)
                    .cause(e)
                    .build();
        }
    }

    private void supervise() {
        ThreadContext.put("deviceId", deviceId);
        try {
            Termination termination;
            try {
                termination = awaitTermination();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                termination = abandon("Interrupted while waiting for dump process");
            } catch (RuntimeException e) {
                LOG.error("Dump supervision failed for {}", deviceId, e);
                termination = abandon("Dump supervision failed: " + e.getMessage());
            }
            finish(termination);
        } finally {
            ThreadContext.remove("deviceId");
        }
    }

    private Termination awaitTermination() throws InterruptedException {
        Process proc;
        ExtractionDeadline armed;
        DumpMode runMode;
        lock.lock();
        try {
            proc = process;
            armed = deadline;
            runMode = mode;
        } finally {
            lock.unlock();
        }

        long tickNanos = settings.progressInterval().toNanos();
        while (true) {
            if (cancelConfirmed()) {
                return terminateForCancellation(proc, armed);
            }
            long remaining = armed.remainingNanos();
            if (remaining <= 0) {
                return expire(proc, armed);
            }
            boolean exited = proc.waitFor(Math.min(tickNanos, remaining), TimeUnit.NANOSECONDS);
            if (exited) {
                if (cancelConfirmed()) {
                    return terminateForCancellation(proc, armed);
                }
                armed.disarm();
                return onProcessExited(proc.exitValue());
            }
            if (runMode == DumpMode.HEADLESS && !armed.isExpired()) {
                publishProgress("Extracting coredump... (" + elapsed().toSeconds() + "s)");
            }
        }
    }

    private Termination terminateForCancellation(Process proc, ExtractionDeadline armed)
            throws InterruptedException {
        armed.disarm();
        boolean cleanup;
        long confirmedAt;
        lock.lock();
        try {
            cleanup = cleanupAfterCancel;
            confirmedAt = cancelConfirmedNanos;
        } finally {
            lock.unlock();
        }

        long graceRemaining = confirmedAt + settings.cancelGracePeriod().toNanos() - nanoClock.getAsLong();
        boolean exited = !proc.isAlive()
                || (graceRemaining > 0 && proc.waitFor(graceRemaining, TimeUnit.NANOSECONDS));
        if (!exited && proc.isAlive()) {
            LOG.warn("Dump process for {} still running {}s after terminate; killing", deviceId,
                    settings.cancelGracePeriod().toSeconds());
            ProcessTermination.kill(proc);
        }
        if (cleanup) {
            runCleanupCommands();
        }
        LOG.info("Dump cancelled for {}", deviceId);
        return new Termination(DumpState.IDLE, DumpOutcome.cancelled(deviceId, currentDirectory(), elapsed()));
    }

    private Termination expire(Process proc, ExtractionDeadline armed) {
        armed.disarm();
        DumpTimeoutException timeout = new DumpTimeoutException(deviceId, armed.timeout());
        LOG.warn(timeout.getMessage());
        ProcessTermination.kill(proc);
        return new Termination(DumpState.TIMEOUT, failure(FailureKind.TIMEOUT, timeout.getMessage()));
    }

    private Termination onProcessExited(int exitCode) {
        ProcessOutput collected = currentOutput();
        if (collected != null) {
            collected.await(ProcessTimeouts.OUTPUT_FLUSH_TIMEOUT);
        }
        if (exitCode != 0) {
            String tail = collected == null ? "" : LogSanitizer.tail(collected.text(), ERROR_SNIPPET_MAX_CHARS);
            DumpProcessException failed = DumpExceptionBuilder.create("Dump script failed")
                    .device(deviceId)
                    .exitCode(exitCode)
                    .durationMs(elapsed().toMillis())
                    .metadata("output", tail.isEmpty() ? null : tail)
                    .build();
            LOG.warn("{} (device={})", failed.getMessage(), deviceId);
            return new Termination(DumpState.FAILED, failure(FailureKind.PROCESS, failed.getMessage()));
        }

        transition(DumpState.VERIFYING);
        publishProgress("Verifying dump results...");
        Path dir = currentDirectory();
        try {
            int archives = verifier.verify(dir);
            String message = "Dump completed successfully - " + archives + " zip files created";
            LOG.info("{} (device={}, durationMs={})", message, deviceId, elapsed().toMillis());
            return new Termination(DumpState.COMPLETED, DumpOutcome.success(deviceId, message, dir, elapsed()));
        } catch (DumpVerificationException e) {
            LOG.warn("Dump verification failed for {}: {}", deviceId, e.getMessage());
            return new Termination(DumpState.FAILED, failure(FailureKind.VERIFICATION, e.getMessage()));
        }
    }

    private Termination abandon(String reason) {
        Process proc;
        ExtractionDeadline armed;
        lock.lock();
        try {
            proc = process;
            armed = deadline;
        } finally {
            lock.unlock();
        }
        if (armed != null) {
            armed.disarm();
        }
        ProcessTermination.kill(proc);
        return new Termination(DumpState.FAILED, failure(FailureKind.PROCESS, reason));
    }

    private void runCleanupCommands() {
        for (String command : settings.cleanupCommands()) {
            ShellResult result = transport.execute(deviceId, command);
            if (result.isOk()) {
                LOG.info("Cleanup command succeeded on {}: {}", deviceId, command);
            } else {
                LOG.warn("Cleanup command failed on {} ({}): {} - {}", deviceId, result.status(), command,
                        result.detail());
            }
        }
    }

    private void finish(Termination termination) {
        DumpOutcome outcome = termination.outcome();
        if (state() != termination.state()) {
            transition(termination.state());
        }
        ProcessOutput collected = currentOutput();
        if (collected != null) {
            collected.await(ProcessTimeouts.OUTPUT_CLEANUP_TIMEOUT);
        }
        publishProgress(outcome.detail());

        Consumer<DumpOutcome> listener;
        DumpMode runMode;
        lock.lock();
        try {
            listener = outcomeListener;
            runMode = mode;
        } finally {
            lock.unlock();
        }
        if (runMode == DumpMode.INTERACTIVE && outcome.status() != OutcomeStatus.CANCELLED) {
            publisher.publishEvent(new DumpCompletionNoticeEvent(deviceId, outcome.isSuccess(),
                    outcome.detail(), outcome.workingDirectory(), Instant.now()));
        }
        try {
            listener.accept(outcome);
        } catch (RuntimeException e) {
            LOG.error("Outcome listener failed for {}", deviceId, e);
        }
        reset();
    }

    private void reset() {
        DumpState previous;
        TriggerReason lastTrigger;
        lock.lock();
        try {
            previous = state;
            lastTrigger = trigger;
            state = DumpState.IDLE;
            process = null;
            output = null;
            outcomeListener = null;
            workingDirectory = null;
            cancelStage = CancelStage.NONE;
            cleanupAfterCancel = false;
        } finally {
            lock.unlock();
        }
        if (previous != DumpState.IDLE) {
            publishTransition(previous, DumpState.IDLE, lastTrigger);
        }
    }

    private void transition(DumpState next) {
        DumpState previous;
        TriggerReason currentTrigger;
        lock.lock();
        try {
            previous = state;
            state = next;
            currentTrigger = trigger;
        } finally {
            lock.unlock();
        }
        publishTransition(previous, next, currentTrigger);
    }

    private void publishTransition(DumpState previous, DumpState next, TriggerReason reason) {
        LOG.debug("Dump state {} → {} for {}", previous, next, deviceId);
        publisher.publishEvent(new DumpStatusChangedEvent(deviceId, previous, next, reason, Instant.now()));
    }

    private void publishProgress(String message) {
        publisher.publishEvent(new DumpProgressEvent(deviceId, message, Instant.now()));
    }

    private DumpOutcome failure(FailureKind kind, String detail) {
        return DumpOutcome.failed(deviceId, kind, detail, currentDirectory(), elapsed());
    }

    private boolean cancelConfirmed() {
        lock.lock();
        try {
            return cancelStage == CancelStage.CONFIRMED;
        } finally {
            lock.unlock();
        }
    }

    private Path currentDirectory() {
        lock.lock();
        try {
            return workingDirectory;
        } finally {
            lock.unlock();
        }
    }

    private ProcessOutput currentOutput() {
        lock.lock();
        try {
            return output;
        } finally {
            lock.unlock();
        }
    }

    private Duration elapsed() {
        long started;
        lock.lock();
        try {
            started = startNanos;
        } finally {
            lock.unlock();
        }
        return TimeUtils.between(started, nanoClock.getAsLong());
    }

    private static long pidOf(Process p) {
        try {
            return p.pid();
        } catch (UnsupportedOperationException e) {
            return -1L;
        }
    }
}
