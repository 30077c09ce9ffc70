package com.phillippitts.fleetdump.service.process;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessOutputTest {

    @Test
    void collectsAllLinesAndNotifiesListener() {
        List<String> seen = new CopyOnWriteArrayList<>();
        ProcessOutput output = ProcessOutput.collect(stream("one\ntwo\nthree\n"), "test-out", 1024, seen::add);

        output.await(Duration.ofSeconds(2));

        assertThat(output.text()).isEqualTo("one\ntwo\nthree");
        assertThat(output.isTruncated()).isFalse();
        assertThat(seen).containsExactly("one", "two", "three");
    }

    @Test
    void keepsMostRecentLinesWhenWindowOverflows() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 100; i++) {
            sb.append("line-").append(i).append('\n');
        }
        ProcessOutput output = ProcessOutput.collect(stream(sb.toString()), "test-out", 20, null);

        output.await(Duration.ofSeconds(2));

        assertThat(output.isTruncated()).isTrue();
        assertThat(output.text()).endsWith("line-99").doesNotContain("line-0\n");
        assertThat(output.text().length()).isLessThanOrEqualTo(20);
    }

    private static ByteArrayInputStream stream(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }
}
