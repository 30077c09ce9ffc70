package com.phillippitts.fleetdump.service.dump;

import com.phillippitts.fleetdump.domain.DumpMode;
import com.phillippitts.fleetdump.domain.DumpOutcome;
import com.phillippitts.fleetdump.domain.DumpState;
import com.phillippitts.fleetdump.domain.FailureKind;
import com.phillippitts.fleetdump.domain.OutcomeStatus;
import com.phillippitts.fleetdump.domain.TriggerReason;
import com.phillippitts.fleetdump.service.dump.event.DumpCompletionNoticeEvent;
import com.phillippitts.fleetdump.service.dump.event.DumpProgressEvent;
import com.phillippitts.fleetdump.service.dump.event.DumpStatusChangedEvent;
import com.phillippitts.fleetdump.testutil.EventCapturingPublisher;
import com.phillippitts.fleetdump.testutil.FakeProcess;
import com.phillippitts.fleetdump.testutil.RecordingDeviceTransport;
import com.phillippitts.fleetdump.testutil.ScriptedProcessFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class DumpJobTest {

    private static final String DEVICE = "R5CT1234";
    private static final List<String> CLEANUP = List.of("rm -rf /data/coredump/*", "rm -rf /data/crash_alarm/*");

    @TempDir
    Path tmp;

    private Path script;
    private Path workDir;
    private ExecutorService supervisors;
    private EventCapturingPublisher publisher;
    private RecordingDeviceTransport transport;
    private final List<DumpOutcome> outcomes = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        script = Files.writeString(tmp.resolve("extract.sh"), "#!/bin/sh\n");
        workDir = tmp.resolve("issues").resolve("251019-101500").resolve(DEVICE);
        supervisors = Executors.newCachedThreadPool();
        publisher = new EventCapturingPublisher();
        transport = new RecordingDeviceTransport();
    }

    @AfterEach
    void tearDown() {
        supervisors.shutdownNow();
    }

    private DumpJobSettings settings(Path scriptPath, Duration headlessTimeout) {
        return new DumpJobSettings(scriptPath, headlessTimeout, Duration.ofSeconds(10),
                Duration.ofMillis(300), Duration.ofMillis(20), List.of("coredump.zip"), CLEANUP);
    }

    private DumpJob job(ScriptedProcessFactory factory) {
        return job(factory, settings(script, Duration.ofSeconds(10)));
    }

    private DumpJob job(ScriptedProcessFactory factory, DumpJobSettings settings) {
        return new DumpJob(DEVICE, settings, factory, transport, supervisors, publisher, System::nanoTime);
    }

    private List<DumpState> transitions() {
        return publisher.eventsOf(DumpStatusChangedEvent.class).stream()
                .map(DumpStatusChangedEvent::current)
                .toList();
    }

    private DumpOutcome awaitOutcome(DumpJob job) {
        await().atMost(Duration.ofSeconds(5)).until(() -> outcomes.size() == 1 && job.state() == DumpState.IDLE);
        return outcomes.get(0);
    }

    @Test
    void successfulExtractionWalksTheFullLifecycle() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.always(FakeProcess.producingArchives(workDir, 2, 50));
        DumpJob job = job(factory);

        assertThat(job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, outcomes::add)).isTrue();
        DumpOutcome outcome = awaitOutcome(job);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.SUCCESS);
        assertThat(outcome.detail()).isEqualTo("Dump completed successfully - 2 zip files created");
        assertThat(outcome.workingDirectory()).isEqualTo(workDir);
        assertThat(transitions()).containsExactly(DumpState.STARTING, DumpState.EXTRACTING,
                DumpState.VERIFYING, DumpState.COMPLETED, DumpState.IDLE);
        assertThat(publisher.eventsOf(DumpCompletionNoticeEvent.class))
                .singleElement()
                .satisfies(notice -> assertThat(notice.success()).isTrue());
    }

    @Test
    void launchesScriptInDeviceDirectoryWithSerialInEnvironment() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.always(FakeProcess.producingArchives(workDir, 1, 20));
        DumpJob job = job(factory);

        job.start(TriggerReason.CRASH_MONITOR, DumpMode.HEADLESS, workDir, outcomes::add);
        awaitOutcome(job);

        assertThat(factory.launches()).singleElement().satisfies(launch -> {
            assertThat(launch.command()).containsExactly(script.toString());
            assertThat(launch.workingDir()).isEqualTo(workDir);
            assertThat(launch.environment()).containsEntry(DumpJob.SERIAL_ENV, DEVICE);
        });
        assertThat(Files.isDirectory(workDir)).isTrue();
    }

    @Test
    void missingScriptFailsSetupWithoutLaunching() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.always(FakeProcess.hanging());
        DumpJob job = job(factory, settings(tmp.resolve("absent.sh"), Duration.ofSeconds(10)));

        job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, outcomes::add);

        // Setup failures are reported before start returns
        assertThat(outcomes).singleElement().satisfies(outcome -> {
            assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
            assertThat(outcome.failureKind()).isEqualTo(FailureKind.SETUP);
            assertThat(outcome.detail()).contains("Dump script not found").contains(DEVICE);
        });
        assertThat(factory.launches()).isEmpty();
        assertThat(job.state()).isEqualTo(DumpState.IDLE);
        assertThat(transitions()).containsExactly(DumpState.STARTING, DumpState.FAILED, DumpState.IDLE);
    }

    @Test
    void unusableWorkingDirectoryFailsSetup() throws IOException {
        Path blocker = Files.writeString(tmp.resolve("not-a-dir"), "x");
        ScriptedProcessFactory factory = ScriptedProcessFactory.always(FakeProcess.hanging());
        DumpJob job = job(factory);

        job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, blocker.resolve(DEVICE), outcomes::add);

        assertThat(outcomes).singleElement().satisfies(outcome -> {
            assertThat(outcome.failureKind()).isEqualTo(FailureKind.SETUP);
            assertThat(outcome.detail()).contains("Failed to create dump directory");
        });
    }

    @Test
    void launchFailureIsReportedAsProcessFailure() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.always(FakeProcess.hanging());
        factory.failLaunchesWith(new IOException("Permission denied"));
        DumpJob job = job(factory);

        job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, outcomes::add);

        assertThat(outcomes).singleElement().satisfies(outcome -> {
            assertThat(outcome.failureKind()).isEqualTo(FailureKind.PROCESS);
            assertThat(outcome.detail()).startsWith("Failed to start dump process")
                    .contains("Permission denied");
        });
        assertThat(job.state()).isEqualTo(DumpState.IDLE);
    }

    @Test
    void nonZeroExitIncludesExitCodeAndOutputTail() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.always(
                FakeProcess.exiting(2, "pulling logs\nadb: device offline\n", 30));
        DumpJob job = job(factory);

        job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, outcomes::add);
        DumpOutcome outcome = awaitOutcome(job);

        assertThat(outcome.failureKind()).isEqualTo(FailureKind.PROCESS);
        assertThat(outcome.detail()).startsWith("Dump script failed (exitCode=2")
                .contains("adb: device offline");
        assertThat(transitions()).containsExactly(DumpState.STARTING, DumpState.EXTRACTING,
                DumpState.FAILED, DumpState.IDLE);
        assertThat(publisher.lastOf(DumpCompletionNoticeEvent.class).success()).isFalse();
    }

    @Test
    void cleanExitWithoutArchivesFailsVerification() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.always(FakeProcess.exiting(0, "", 20));
        DumpJob job = job(factory);

        job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, outcomes::add);
        DumpOutcome outcome = awaitOutcome(job);

        assertThat(outcome.failureKind()).isEqualTo(FailureKind.VERIFICATION);
        assertThat(outcome.detail()).isEqualTo("No zip files were created");
        assertThat(transitions()).contains(DumpState.VERIFYING, DumpState.FAILED);
    }

    @Test
    void emptyArchivesFailVerification() {
        FakeProcess process = new FakeProcess().finishAfter(20, 0, () -> {
            try {
                Files.createDirectories(workDir);
                Files.createFile(workDir.resolve("coredump.zip"));
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });
        DumpJob job = job(ScriptedProcessFactory.always(process));

        job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, outcomes::add);

        assertThat(awaitOutcome(job).detail()).isEqualTo("Dump produced only empty zip files (1)");
    }

    @Test
    void expiredDeadlineKillsProcessAndReportsTimeoutOnce() {
        FakeProcess process = FakeProcess.hanging();
        DumpJob job = job(ScriptedProcessFactory.always(process), settings(script, Duration.ofMillis(250)));

        job.start(TriggerReason.CRASH_MONITOR, DumpMode.HEADLESS, workDir, outcomes::add);
        DumpOutcome outcome = awaitOutcome(job);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(outcome.detail()).contains("timed out");
        assertThat(process.killCalls()).isEqualTo(1);
        assertThat(process.terminateCalls()).isZero();
        assertThat(process.exitValue()).isEqualTo(FakeProcess.KILLED_EXIT);
        assertThat(job.isDeadlineArmed()).isFalse();
        assertThat(transitions()).containsExactly(DumpState.STARTING, DumpState.EXTRACTING,
                DumpState.TIMEOUT, DumpState.IDLE);

        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).until(() -> outcomes.size() == 1);
    }

    @Test
    void headlessExtractionPublishesPeriodicProgress() {
        FakeProcess process = FakeProcess.producingArchives(workDir, 1, 150);
        DumpJob job = job(ScriptedProcessFactory.always(process));

        job.start(TriggerReason.CRASH_MONITOR, DumpMode.HEADLESS, workDir, outcomes::add);
        awaitOutcome(job);

        assertThat(publisher.eventsOf(DumpProgressEvent.class))
                .extracting(DumpProgressEvent::message)
                .anyMatch(message -> message.startsWith("Extracting coredump... ("))
                .anyMatch(message -> message.startsWith("Extracting dump... (PID: "));
        // Headless jobs do not prompt an operator
        assertThat(publisher.eventsOf(DumpCompletionNoticeEvent.class)).isEmpty();
    }

    @Test
    void confirmedCancellationStopsProcessRunsCleanupAndReportsCancelled() {
        FakeProcess process = FakeProcess.hanging();
        DumpJob job = job(ScriptedProcessFactory.always(process));
        job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, outcomes::add);
        assertThat(job.state()).isEqualTo(DumpState.EXTRACTING);

        assertThat(job.requestCancel()).isTrue();
        assertThat(job.isCancelRequested()).isTrue();
        // A request alone leaves the extraction running
        assertThat(process.isAlive()).isTrue();
        assertThat(outcomes).isEmpty();

        assertThat(job.confirmCancel(true)).isTrue();
        DumpOutcome outcome = awaitOutcome(job);

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.CANCELLED);
        assertThat(outcome.failureKind()).isNull();
        assertThat(outcome.detail()).isEqualTo("cancelled");
        assertThat(process.terminateCalls()).isEqualTo(1);
        assertThat(transport.commands())
                .extracting(RecordingDeviceTransport.Command::shellCommand)
                .containsExactlyElementsOf(CLEANUP);
        assertThat(transport.commands()).allMatch(command -> command.deviceId().equals(DEVICE));
        assertThat(publisher.eventsOf(DumpCompletionNoticeEvent.class)).isEmpty();
        assertThat(transitions()).containsExactly(DumpState.STARTING, DumpState.EXTRACTING, DumpState.IDLE);
    }

    @Test
    void processIgnoringTerminateIsKilledAfterGracePeriod() {
        FakeProcess process = FakeProcess.hanging().ignoringTerminate();
        DumpJob job = job(ScriptedProcessFactory.always(process));
        job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, outcomes::add);

        job.requestCancel();
        job.confirmCancel(false);

        DumpOutcome outcome = awaitOutcome(job);
        assertThat(outcome.status()).isEqualTo(OutcomeStatus.CANCELLED);
        assertThat(process.killCalls()).isGreaterThanOrEqualTo(1);
        assertThat(process.isAlive()).isFalse();
        assertThat(transport.commands()).isEmpty();
    }

    @Test
    void withdrawnCancellationLetsExtractionFinish() {
        FakeProcess process = FakeProcess.hanging();
        DumpJob job = job(ScriptedProcessFactory.always(process));
        job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, outcomes::add);

        assertThat(job.requestCancel()).isTrue();
        assertThat(job.withdrawCancel()).isTrue();
        assertThat(job.confirmCancel(true)).isFalse();

        FakeProcess.writeArchives(workDir, 1);
        process.finish(0);

        assertThat(awaitOutcome(job).status()).isEqualTo(OutcomeStatus.SUCCESS);
        assertThat(process.terminateCalls()).isZero();
    }

    @Test
    void cancellationIsNotOfferedForHeadlessJobs() {
        FakeProcess process = FakeProcess.hanging();
        DumpJob job = job(ScriptedProcessFactory.always(process));
        job.start(TriggerReason.HEALTH_CHECK_FAILED, DumpMode.HEADLESS, workDir, outcomes::add);

        assertThat(job.requestCancel()).isFalse();
        assertThat(job.confirmCancel(true)).isFalse();

        process.finish(1);
        assertThat(awaitOutcome(job).failureKind()).isEqualTo(FailureKind.PROCESS);
    }

    @Test
    void confirmWithoutRequestIsRejected() {
        FakeProcess process = FakeProcess.hanging();
        DumpJob job = job(ScriptedProcessFactory.always(process));
        job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, outcomes::add);

        assertThat(job.confirmCancel(true)).isFalse();
        assertThat(job.withdrawCancel()).isFalse();
        assertThat(process.isAlive()).isTrue();

        job.abort();
        assertThat(awaitOutcome(job).status()).isEqualTo(OutcomeStatus.FAILED);
    }

    @Test
    void startWhileRunningIsRejected() {
        FakeProcess process = FakeProcess.hanging();
        DumpJob job = job(ScriptedProcessFactory.always(process));
        job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, outcomes::add);

        List<DumpOutcome> second = new CopyOnWriteArrayList<>();
        assertThat(job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, second::add)).isFalse();

        FakeProcess.writeArchives(workDir, 1);
        process.finish(0);
        awaitOutcome(job);
        assertThat(second).isEmpty();
    }

    @Test
    void jobCanRunAgainAfterReportingOutcome() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(
                (device, dir) -> FakeProcess.producingArchives(dir, 1, 20));
        DumpJob job = job(factory);

        job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, outcomes::add);
        awaitOutcome(job);
        outcomes.clear();

        assertThat(job.start(TriggerReason.MANUAL, DumpMode.INTERACTIVE, workDir, outcomes::add)).isTrue();
        assertThat(awaitOutcome(job).isSuccess()).isTrue();
        assertThat(factory.launches()).hasSize(2);
    }
}
