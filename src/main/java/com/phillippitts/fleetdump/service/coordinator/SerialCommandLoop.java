package com.phillippitts.fleetdump.service.coordinator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs submitted commands one at a time, in submission order, on a backing executor.
 *
 * <p>At most one drain task is outstanding, so commands never overlap even on a multi-threaded
 * executor. A command may submit further commands; they run after it returns, never nested
 * inside it. This holds for a caller-runs executor too.
 */
public final class SerialCommandLoop implements Executor {

    private static final Logger LOG = LogManager.getLogger(SerialCommandLoop.class);

    private final Executor delegate;
    private final Queue<Runnable> commands = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();

    public SerialCommandLoop(Executor delegate) {
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable command) {
        commands.add(command);
        scheduleDrain();
    }

    /**
     * Runs {@code action} on the loop and completes the future with its result, or exceptionally
     * with whatever it threw.
     */
    public <T> CompletableFuture<T> call(Supplier<T> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        execute(() -> {
            try {
                result.complete(action.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            try {
                delegate.execute(this::drain);
            } catch (RuntimeException e) {
                draining.set(false);
                throw e;
            }
        }
    }

    private void drain() {
        try {
            Runnable command;
            while ((command = commands.poll()) != null) {
                try {
                    command.run();
                } catch (RuntimeException e) {
                    LOG.error("Coordinator command failed", e);
                }
            }
        } finally {
            draining.set(false);
            if (!commands.isEmpty()) {
                scheduleDrain();
            }
        }
    }
}
