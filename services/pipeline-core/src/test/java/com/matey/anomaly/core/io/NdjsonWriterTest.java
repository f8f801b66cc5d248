package com.matey.anomaly.core.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NdjsonWriterTest {

    @Test
    void writesOneDocumentPerLine() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        NdjsonWriter writer = new NdjsonWriter(new ObjectMapper(), new PrintStream(bytes, true, StandardCharsets.UTF_8));

        assertThat(writer.write(Map.of("id", "1"))).isTrue();
        assertThat(writer.write(Map.of("id", "2"))).isTrue();

        assertThat(bytes.toString(StandardCharsets.UTF_8)).isEqualTo("{\"id\":\"1\"}\n{\"id\":\"2\"}\n");
    }

    @Test
    void reportsBrokenStream() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("Broken pipe");
            }
        };
        NdjsonWriter writer = new NdjsonWriter(new ObjectMapper(), new PrintStream(broken, true, StandardCharsets.UTF_8));

        assertThat(writer.write(Map.of("id", "1"))).isFalse();
    }
}
