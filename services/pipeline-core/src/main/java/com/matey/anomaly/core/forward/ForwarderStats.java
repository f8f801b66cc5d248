package com.matey.anomaly.core.forward;

import lombok.Data;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for a single {@link Forwarder}. Owned by the forwarder instance, read for the
 * shutdown summary and the metrics endpoint.
 */
public class ForwarderStats {

    private final AtomicLong eventsForwarded = new AtomicLong();
    private final AtomicLong anomaliesDetected = new AtomicLong();
    private final AtomicLong batchesSent = new AtomicLong();
    private final AtomicLong batchesDropped = new AtomicLong();
    private final AtomicLong eventsDropped = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();

    // ---- latency (micros) ----
    private final AtomicLong calls = new AtomicLong();
    private final AtomicLong latencySumMicros = new AtomicLong();
    private final AtomicLong latencyMaxMicros = new AtomicLong();
    private final AtomicLong lastLatencyMicros = new AtomicLong();

    void recordSuccess(int events, int anomalies) {
        batchesSent.incrementAndGet();
        eventsForwarded.addAndGet(events);
        anomaliesDetected.addAndGet(anomalies);
    }

    void recordDropped(int events) {
        batchesDropped.incrementAndGet();
        eventsDropped.addAndGet(events);
    }

    void recordRetry() {
        retries.incrementAndGet();
    }

    void recordRateLimited() {
        rateLimited.incrementAndGet();
    }

    void recordLatency(long micros) {
        calls.incrementAndGet();
        latencySumMicros.addAndGet(micros);
        lastLatencyMicros.set(micros);
        latencyMaxMicros.accumulateAndGet(micros, Math::max);
    }

    public long getEventsForwarded() {
        return eventsForwarded.get();
    }

    public long getAnomaliesDetected() {
        return anomaliesDetected.get();
    }

    public Snapshot snapshot() {
        Snapshot s = new Snapshot();
        s.setEventsForwarded(eventsForwarded.get());
        s.setAnomaliesDetected(anomaliesDetected.get());
        s.setBatchesSent(batchesSent.get());
        s.setBatchesDropped(batchesDropped.get());
        s.setEventsDropped(eventsDropped.get());
        s.setRetries(retries.get());
        s.setRateLimited(rateLimited.get());
        long n = calls.get();
        s.setCalls(n);
        s.setAvgLatencyMicros(n == 0 ? 0.0 : (double) latencySumMicros.get() / n);
        s.setMaxLatencyMicros(latencyMaxMicros.get());
        s.setLastLatencyMicros(lastLatencyMicros.get());
        return s;
    }

    @Data
    public static class Snapshot {
        private long eventsForwarded;
        private long anomaliesDetected;
        private long batchesSent;
        private long batchesDropped;
        private long eventsDropped;
        private long retries;
        private long rateLimited;
        private long calls;
        private double avgLatencyMicros;
        private long maxLatencyMicros;
        private long lastLatencyMicros;
    }
}
