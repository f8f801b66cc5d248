package com.matey.anomaly.detector.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.matey.anomaly.core.forward.ForwardResult;
import com.matey.anomaly.core.io.NdjsonWriter;
import com.matey.anomaly.core.lifecycle.ApplicationTerminator;
import com.matey.anomaly.core.model.AnomalyRecord;
import com.matey.anomaly.core.model.CanonicalRecord;
import com.matey.anomaly.detector.metrics.PipelineStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one detection result per forwarded record to stdout: the record's own fields
 * plus {@code anomaly}, and for anomalous records {@code anomaly_score},
 * {@code explanation} and {@code metrics}.
 *
 * Batches that were not evaluated (dropped or halted) produce no output.
 */
@Slf4j
@RequiredArgsConstructor
public class DetectionResultEmitter implements BatchResultListener {

    public static final int EXIT_OUTPUT_CLOSED = 1;

    private final NdjsonWriter writer;
    private final ObjectMapper objectMapper;
    private final PipelineStats stats;
    private final ApplicationTerminator terminator;

    @Override
    public void onResult(List<CanonicalRecord> batch, ForwardResult result) {
        if (!result.isSuccess()) {
            return;
        }

        Map<Integer, AnomalyRecord> byIndex = new HashMap<>();
        for (AnomalyRecord anomaly : result.getAnomalies()) {
            Integer index = anomaly.getIndex();
            if (index == null || index < 0 || index >= batch.size()) {
                log.warn("Anomaly without a valid batch index ({}); not attributed to any record", index);
                continue;
            }
            byIndex.put(index, anomaly);
        }

        for (int i = 0; i < batch.size(); i++) {
            ObjectNode line = objectMapper.valueToTree(batch.get(i).asMap());
            AnomalyRecord anomaly = byIndex.get(i);
            line.put("anomaly", anomaly != null);
            if (anomaly != null) {
                Double score = anomaly.metric("ncd") != null ? anomaly.metric("ncd") : anomaly.metric("confidence");
                if (score != null) {
                    line.put("anomaly_score", score);
                }
                line.put("explanation", anomaly.getExplanation());
                line.set("metrics", objectMapper.valueToTree(anomaly.getMetrics()));
            }
            if (!writer.write(line)) {
                terminator.terminate(EXIT_OUTPUT_CLOSED, "stdout closed by reader");
                return;
            }
            stats.recordEmitted(1);
        }
    }
}
