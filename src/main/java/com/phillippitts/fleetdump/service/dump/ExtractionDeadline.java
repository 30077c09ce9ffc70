package com.phillippitts.fleetdump.service.dump;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Monotonic deadline armed when an extraction process starts.
 *
 * <p>Every terminal path of a job (exit, cancellation, expiry) disarms it; only the first
 * {@link #disarm()} wins, so expiry can never fire after the job already finished.
 */
final class ExtractionDeadline {

    private final Duration timeout;
    private final LongSupplier nanoClock;
    private final long deadlineNanos;
    private final AtomicBoolean armed = new AtomicBoolean(true);

    private ExtractionDeadline(Duration timeout, LongSupplier nanoClock) {
        this.timeout = timeout;
        this.nanoClock = nanoClock;
        this.deadlineNanos = nanoClock.getAsLong() + timeout.toNanos();
    }

    static ExtractionDeadline arm(Duration timeout, LongSupplier nanoClock) {
        return new ExtractionDeadline(timeout, nanoClock);
    }

    long remainingNanos() {
        return deadlineNanos - nanoClock.getAsLong();
    }

    boolean isExpired() {
        return remainingNanos() <= 0;
    }

    boolean isArmed() {
        return armed.get();
    }

    /**
     * @return true for the call that actually disarmed the deadline
     */
    boolean disarm() {
        return armed.compareAndSet(true, false);
    }

    Duration timeout() {
        return timeout;
    }
}
