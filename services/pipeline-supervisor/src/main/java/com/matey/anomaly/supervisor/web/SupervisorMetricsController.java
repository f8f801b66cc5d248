package com.matey.anomaly.supervisor.web;

import com.matey.anomaly.supervisor.anomaly.DetectorOutputHandler;
import com.matey.anomaly.supervisor.metrics.SupervisorMetrics;
import com.matey.anomaly.supervisor.process.ProcessSupervisor;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /metrics/supervisor -> supervisor state, anomaly queue depth and notification counters
 */
@RestController
@RequiredArgsConstructor
public class SupervisorMetricsController {

    private final SupervisorMetrics metrics;
    private final ProcessSupervisor supervisor;
    private final DetectorOutputHandler outputHandler;

    @GetMapping("/metrics/supervisor")
    public SupervisorMetrics.Snapshot getSupervisorMetrics() {
        return metrics.snapshot(supervisor.getState(), outputHandler.queueDepth());
    }
}
