package com.matey.anomaly.supervisor.anomaly;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.io.AppendOnlyLog;
import com.matey.anomaly.supervisor.metrics.SupervisorMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.BlockingQueue;

/**
 * Handles each line the detector writes to stdout.
 *
 * The line is appended verbatim to the stream log first, whatever it contains. It is
 * then parsed, and results flagged {@code "anomaly": true} are offered to the anomaly
 * queue. A full queue never blocks the reader: the anomaly is logged, counted and
 * dropped.
 */
@Slf4j
@RequiredArgsConstructor
public class DetectorOutputHandler implements Closeable {

    private final AppendOnlyLog streamLog;
    private final ObjectMapper objectMapper;
    private final BlockingQueue<JsonNode> anomalyQueue;
    private final SupervisorMetrics metrics;

    public void onLine(String line) {
        metrics.recordLine();
        try {
            streamLog.append(line);
        } catch (IOException e) {
            metrics.recordLogWriteFailure();
            log.warn("Failed to append detector output to {}: {}", streamLog.getPath(), e.getMessage());
        }

        JsonNode result;
        try {
            result = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            metrics.recordUnparsed();
            log.debug("Detector output is not JSON: {}", line);
            return;
        }
        if (result == null || !result.path("anomaly").asBoolean(false)) {
            return;
        }

        log.info("Anomaly detected! id={} symbol={} score={}",
                safeText(result, "id"), safeText(result, "symbol"), safeText(result, "anomaly_score"));
        if (anomalyQueue.offer(result)) {
            metrics.recordAnomalyQueued();
        } else {
            metrics.recordQueueOverflow();
            log.warn("Anomaly queue full; dropping anomaly id={}", safeText(result, "id"));
        }
    }

    public int queueDepth() {
        return anomalyQueue.size();
    }

    @Override
    public void close() {
        try {
            streamLog.close();
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", streamLog.getPath(), e.getMessage());
        }
    }

    private static String safeText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "n/a" : value.asText();
    }
}
