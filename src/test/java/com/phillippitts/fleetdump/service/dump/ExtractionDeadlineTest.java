package com.phillippitts.fleetdump.service.dump;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionDeadlineTest {

    private final AtomicLong now = new AtomicLong(1_000L);

    @Test
    void expiresOnceTheTimeoutHasElapsed() {
        ExtractionDeadline deadline = ExtractionDeadline.arm(Duration.ofNanos(500), now::get);

        assertThat(deadline.remainingNanos()).isEqualTo(500);
        assertThat(deadline.isExpired()).isFalse();

        now.addAndGet(500);
        assertThat(deadline.isExpired()).isTrue();
    }

    @Test
    void onlyFirstDisarmWins() {
        ExtractionDeadline deadline = ExtractionDeadline.arm(Duration.ofSeconds(1), now::get);

        assertThat(deadline.isArmed()).isTrue();
        assertThat(deadline.disarm()).isTrue();
        assertThat(deadline.disarm()).isFalse();
        assertThat(deadline.isArmed()).isFalse();
    }
}
