package com.matey.anomaly.detector.metrics;

import com.matey.anomaly.core.forward.ForwarderStats;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for one pipeline run: what came in from the source, what was rejected as
 * malformed, and (through the forwarder's own stats) what went out.
 */
public class PipelineStats {

    private final Instant startedAt = Instant.now();

    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong recordsAccepted = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private final AtomicLong resultsEmitted = new AtomicLong();

    public void recordReceived() {
        messagesReceived.incrementAndGet();
    }

    public void recordAccepted() {
        recordsAccepted.incrementAndGet();
    }

    public void recordMalformed() {
        malformed.incrementAndGet();
    }

    public void recordEmitted(int count) {
        resultsEmitted.addAndGet(count);
    }

    public long getMalformed() {
        return malformed.get();
    }

    public long getRecordsAccepted() {
        return recordsAccepted.get();
    }

    public Snapshot snapshot(ForwarderStats forwarderStats) {
        ForwarderStats.Snapshot forwarded = forwarderStats.snapshot();

        Snapshot s = new Snapshot();
        s.setStartedAt(startedAt);
        s.setUptimeSeconds(Duration.between(startedAt, Instant.now()).toSeconds());
        s.setMessagesReceived(messagesReceived.get());
        s.setRecordsAccepted(recordsAccepted.get());
        s.setMalformed(malformed.get());
        s.setResultsEmitted(resultsEmitted.get());
        s.setForwarder(forwarded);
        s.setAnomalyRatePercent(forwarded.getEventsForwarded() == 0
                ? 0.0
                : 100.0 * forwarded.getAnomaliesDetected() / forwarded.getEventsForwarded());
        return s;
    }

    @Data
    public static class Snapshot {
        private Instant startedAt;
        private long uptimeSeconds;
        private long messagesReceived;
        private long recordsAccepted;
        private long malformed;
        private long resultsEmitted;
        private double anomalyRatePercent;
        private ForwarderStats.Snapshot forwarder;
    }
}
