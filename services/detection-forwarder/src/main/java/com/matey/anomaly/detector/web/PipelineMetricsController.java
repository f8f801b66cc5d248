package com.matey.anomaly.detector.web;

import com.matey.anomaly.core.forward.Forwarder;
import com.matey.anomaly.detector.metrics.PipelineStats;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /metrics/pipeline -> source, batching and forwarding counters of the running pipeline
 */
@RestController
@RequiredArgsConstructor
public class PipelineMetricsController {

    private final PipelineStats pipelineStats;
    private final Forwarder forwarder;

    @GetMapping("/metrics/pipeline")
    public PipelineStats.Snapshot getPipelineMetrics() {
        return pipelineStats.snapshot(forwarder.getStats());
    }
}
