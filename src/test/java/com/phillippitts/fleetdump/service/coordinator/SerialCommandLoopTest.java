package com.phillippitts.fleetdump.service.coordinator;

import com.phillippitts.fleetdump.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SerialCommandLoopTest {

    @Test
    void nestedCommandsRunAfterTheCurrentOneOnCallerRunsExecutor() {
        SerialCommandLoop loop = new SerialCommandLoop(new SyncExecutor());
        List<String> order = new CopyOnWriteArrayList<>();

        loop.execute(() -> {
            order.add("outer-start");
            loop.execute(() -> order.add("inner"));
            order.add("outer-end");
        });

        assertThat(order).containsExactly("outer-start", "outer-end", "inner");
    }

    @Test
    void callCompletesWithResultOrFailure() throws Exception {
        SerialCommandLoop loop = new SerialCommandLoop(new SyncExecutor());

        assertThat(loop.call(() -> 42).get()).isEqualTo(42);
        assertThatThrownBy(() -> loop.call(() -> {
            throw new IllegalStateException("boom");
        }).get())
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void failingCommandDoesNotStopTheLoop() {
        SerialCommandLoop loop = new SerialCommandLoop(new SyncExecutor());
        List<String> ran = new CopyOnWriteArrayList<>();

        loop.execute(() -> {
            loop.execute(() -> {
                throw new IllegalStateException("boom");
            });
            loop.execute(() -> ran.add("after"));
        });

        assertThat(ran).containsExactly("after");
    }

    @Test
    void commandsNeverOverlapOnAThreadPool() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        ExecutorService submitters = Executors.newFixedThreadPool(4);
        try {
            SerialCommandLoop loop = new SerialCommandLoop(pool);
            AtomicInteger running = new AtomicInteger();
            AtomicInteger maxRunning = new AtomicInteger();
            int commands = 400;
            CountDownLatch done = new CountDownLatch(commands);

            for (int i = 0; i < commands; i++) {
                submitters.execute(() -> loop.execute(() -> {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    Thread.yield();
                    running.decrementAndGet();
                    done.countDown();
                }));
            }

            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(maxRunning.get()).isEqualTo(1);
        } finally {
            submitters.shutdownNow();
            pool.shutdownNow();
        }
    }
}
