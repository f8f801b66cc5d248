package com.matey.anomaly.core.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppendOnlyLogTest {

    @TempDir
    Path tempDir;

    @Test
    void appendsAcrossRuns() throws IOException {
        Path file = tempDir.resolve("logs/stream.ndjson");

        try (AppendOnlyLog first = AppendOnlyLog.open(file)) {
            first.append("{\"a\":1}");
        }
        try (AppendOnlyLog second = AppendOnlyLog.open(file)) {
            second.append("{\"b\":2}");
            assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}\n{\"b\":2}\n");
            assertThat(second.getLinesWritten()).isEqualTo(1);
        }
    }

    @Test
    void refusesWritesAfterClose() throws IOException {
        AppendOnlyLog log = AppendOnlyLog.open(tempDir.resolve("x.ndjson"));
        log.close();

        assertThatThrownBy(() -> log.append("late")).isInstanceOf(IOException.class);
    }
}
