package com.matey.anomaly.detector.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.model.CanonicalRecord;
import com.matey.anomaly.detector.metrics.PipelineStats;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Canonical records as NDJSON lines on an input stream, typically the feed bridge's
 * stdout piped into this process. Each line is validated again; invalid lines are
 * counted and skipped. Returns at end of input.
 */
@Slf4j
public class StdinRecordSource implements RecordSource {

    private final InputStream input;
    private final ObjectMapper objectMapper;
    private final PipelineStats stats;

    private volatile boolean stopped;

    public StdinRecordSource(InputStream input, ObjectMapper objectMapper, PipelineStats stats) {
        this.input = input;
        this.objectMapper = objectMapper;
        this.stats = stats;
    }

    @Override
    public void run(Consumer<CanonicalRecord> sink) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while (!stopped && (line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                stats.recordReceived();
                try {
                    sink.accept(objectMapper.readValue(line, CanonicalRecord.class));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    stats.recordMalformed();
                    log.debug("Skipping invalid input line: {}", e.getMessage());
                }
            }
        } catch (IOException e) {
            if (!stopped) {
                throw new IllegalStateException("Failed reading input: " + e.getMessage(), e);
            }
        }
        log.info("Input closed after {} records ({} invalid)", stats.getRecordsAccepted(), stats.getMalformed());
    }

    @Override
    public void stop() {
        stopped = true;
    }

    @Override
    public String describe() {
        return "stdin";
    }
}
