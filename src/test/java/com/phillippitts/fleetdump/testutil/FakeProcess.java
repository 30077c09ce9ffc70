package com.phillippitts.fleetdump.testutil;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Controllable {@link Process} for hermetic dump tests.
 *
 * <p>The process stays alive until {@link #finish(int)} is called, a scheduled finish fires, or it
 * is signalled. {@link #destroy()} exits with 143 unless the process was built with
 * {@link #ignoringTerminate()}; {@link #destroyForcibly()} always exits with 137.
 */
public class FakeProcess extends Process {

    public static final int TERMINATED_EXIT = 143;
    public static final int KILLED_EXIT = 137;

    private static final AtomicInteger NEXT_PID = new AtomicInteger(40_000);

    private final CountDownLatch exited = new CountDownLatch(1);
    private final AtomicBoolean finished = new AtomicBoolean();
    private final AtomicInteger terminateCalls = new AtomicInteger();
    private final AtomicInteger killCalls = new AtomicInteger();
    private final long pid = NEXT_PID.incrementAndGet();
    private final byte[] stdout;
    private volatile boolean ignoresTerminate;
    private volatile int exitCode = -1;

    public FakeProcess() {
        this("");
    }

    public FakeProcess(String stdout) {
        this.stdout = stdout.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * A process that runs until told otherwise.
     */
    public static FakeProcess hanging() {
        return new FakeProcess();
    }

    /**
     * A process that writes {@code count} non-empty archives into {@code dir} and exits 0.
     */
    public static FakeProcess producingArchives(Path dir, int count, long afterMillis) {
        return new FakeProcess().finishAfter(afterMillis, 0, () -> writeArchives(dir, count));
    }

    public static FakeProcess exiting(int exitCode, String stdout, long afterMillis) {
        return new FakeProcess(stdout).finishAfter(afterMillis, exitCode, () -> { });
    }

    public FakeProcess ignoringTerminate() {
        this.ignoresTerminate = true;
        return this;
    }

    /**
     * Schedules an exit on a daemon thread. {@code beforeExit} runs just before the exit is visible.
     */
    public FakeProcess finishAfter(long millis, int code, Runnable beforeExit) {
        Thread finisher = new Thread(() -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (isAlive()) {
                beforeExit.run();
                finish(code);
            }
        }, "fake-process-" + pid);
        finisher.setDaemon(true);
        finisher.start();
        return this;
    }

    public void finish(int code) {
        if (finished.compareAndSet(false, true)) {
            exitCode = code;
            exited.countDown();
        }
    }

    public int terminateCalls() {
        return terminateCalls.get();
    }

    public int killCalls() {
        return killCalls.get();
    }

    public static void writeArchives(Path dir, int count) {
        try {
            Files.createDirectories(dir);
            for (int i = 0; i < count; i++) {
                Files.write(dir.resolve("coredump-" + i + ".zip"), new byte[]{'P', 'K', 3, 4});
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public OutputStream getOutputStream() {
        return new ByteArrayOutputStream();
    }

    @Override
    public InputStream getInputStream() {
        return new ByteArrayInputStream(stdout);
    }

    @Override
    public InputStream getErrorStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public int waitFor() throws InterruptedException {
        exited.await();
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        return exited.await(timeout, unit);
    }

    @Override
    public int exitValue() {
        if (isAlive()) {
            throw new IllegalThreadStateException("process has not exited");
        }
        return exitCode;
    }

    @Override
    public void destroy() {
        terminateCalls.incrementAndGet();
        if (!ignoresTerminate) {
            finish(TERMINATED_EXIT);
        }
    }

    @Override
    public Process destroyForcibly() {
        killCalls.incrementAndGet();
        finish(KILLED_EXIT);
        return this;
    }

    @Override
    public boolean isAlive() {
        return exited.getCount() > 0;
    }

    @Override
    public long pid() {
        return pid;
    }
}
