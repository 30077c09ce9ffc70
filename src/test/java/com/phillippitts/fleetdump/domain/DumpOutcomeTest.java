package com.phillippitts.fleetdump.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DumpOutcomeTest {

    @Test
    void failedOutcomeRequiresKind() {
        assertThatThrownBy(() -> new DumpOutcome("dev-1", OutcomeStatus.FAILED, null, "x", null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void onlyFailedOutcomeMayCarryKind() {
        assertThatThrownBy(() -> new DumpOutcome("dev-1", OutcomeStatus.SUCCESS, FailureKind.PROCESS, "x", null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullDetailAndElapsedAreNormalized() {
        DumpOutcome outcome = DumpOutcome.cancelled("dev-1", null, null);

        assertThat(outcome.detail()).isEqualTo("cancelled");
        assertThat(outcome.elapsed()).isEqualTo(Duration.ZERO);
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(new DumpOutcome("dev-2", OutcomeStatus.SUCCESS, null, null, null, null).detail()).isEmpty();
    }

    @Test
    void declinedUploadIsRecognised() {
        UploadOutcome declined = UploadOutcome.declined("251019-101530", Instant.EPOCH);

        assertThat(declined.isDeclined()).isTrue();
        assertThat(declined.success()).isFalse();
        assertThat(declined.uploadedFiles()).isEmpty();
    }
}
