package com.phillippitts.fleetdump.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DumpExceptionBuilderTest {

    @Test
    void buildsPlainMessageWithoutDetails() {
        DumpProcessException ex = DumpExceptionBuilder.create("Dump script failed").device("dev-1").build();

        assertThat(ex.getMessage()).isEqualTo("Dump script failed");
        assertThat(ex.getDeviceId()).isEqualTo("dev-1");
        assertThat(ex.getExitCode()).isNull();
    }

    @Test
    void appendsDetailsInOrder() {
        DumpProcessException ex = DumpExceptionBuilder.create("Dump script failed")
                .device("dev-1")
                .exitCode(2)
                .durationMs(1234)
                .metadata("output", "adb: device offline")
                .metadata("ignored", null)
                .build();

        assertThat(ex.getMessage())
                .isEqualTo("Dump script failed (exitCode=2, durationMs=1234, output=adb: device offline)");
        assertThat(ex.getExitCode()).isEqualTo(2);
    }

    @Test
    void keepsCauseAndDefaultsDevice() {
        IOException cause = new IOException("permission denied");
        DumpProcessException ex = DumpExceptionBuilder.create("Failed to start dump process")
                .cause(cause)
                .build();

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getDeviceId()).isEqualTo("unknown");
    }

    @Test
    void rejectsEmptyMessage() {
        assertThatThrownBy(() -> DumpExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
