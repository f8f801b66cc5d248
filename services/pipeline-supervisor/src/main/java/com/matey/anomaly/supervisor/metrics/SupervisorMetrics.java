package com.matey.anomaly.supervisor.metrics;

import com.matey.anomaly.supervisor.process.SupervisorState;
import lombok.Data;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory counters of the supervised run: detector output lines, anomalies queued or
 * dropped, notification batches sent or failed.
 */
public class SupervisorMetrics {

    private final AtomicLong detectorLines = new AtomicLong();
    private final AtomicLong unparsedLines = new AtomicLong();
    private final AtomicLong logWriteFailures = new AtomicLong();
    private final AtomicLong anomaliesQueued = new AtomicLong();
    private final AtomicLong queueOverflow = new AtomicLong();

    private final AtomicLong notificationsSent = new AtomicLong();
    private final AtomicLong notificationsFailed = new AtomicLong();
    private final AtomicLong anomaliesNotified = new AtomicLong();

    public void recordLine() {
        detectorLines.incrementAndGet();
    }

    public void recordUnparsed() {
        unparsedLines.incrementAndGet();
    }

    public void recordLogWriteFailure() {
        logWriteFailures.incrementAndGet();
    }

    public void recordAnomalyQueued() {
        anomaliesQueued.incrementAndGet();
    }

    public void recordQueueOverflow() {
        queueOverflow.incrementAndGet();
    }

    public void recordNotification(int batchSize, boolean delivered) {
        if (delivered) {
            notificationsSent.incrementAndGet();
            anomaliesNotified.addAndGet(batchSize);
        } else {
            notificationsFailed.incrementAndGet();
        }
    }

    public Snapshot snapshot(SupervisorState state, int queueDepth) {
        Snapshot s = new Snapshot();
        s.setState(state);
        s.setQueueDepth(queueDepth);
        s.setDetectorLines(detectorLines.get());
        s.setUnparsedLines(unparsedLines.get());
        s.setLogWriteFailures(logWriteFailures.get());
        s.setAnomaliesQueued(anomaliesQueued.get());
        s.setQueueOverflow(queueOverflow.get());
        s.setNotificationsSent(notificationsSent.get());
        s.setNotificationsFailed(notificationsFailed.get());
        s.setAnomaliesNotified(anomaliesNotified.get());
        return s;
    }

    @Data
    public static class Snapshot {
        private SupervisorState state;
        private int queueDepth;
        private long detectorLines;
        private long unparsedLines;
        private long logWriteFailures;
        private long anomaliesQueued;
        private long queueOverflow;
        private long notificationsSent;
        private long notificationsFailed;
        private long anomaliesNotified;
    }
}
