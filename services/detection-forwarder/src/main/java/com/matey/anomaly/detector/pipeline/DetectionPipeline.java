package com.matey.anomaly.detector.pipeline;

import com.matey.anomaly.core.batch.Batcher;
import com.matey.anomaly.core.forward.ForwardResult;
import com.matey.anomaly.core.forward.Forwarder;
import com.matey.anomaly.core.forward.ForwarderStats;
import com.matey.anomaly.core.lifecycle.ApplicationTerminator;
import com.matey.anomaly.core.model.CanonicalRecord;
import com.matey.anomaly.detector.metrics.PipelineStats;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the detection pipeline: record source -> batcher -> forwarder.
 *
 * Three threads are involved:
 *
 * "feed-receiver" – drives the record source and submits every record to the batcher
 *
 * "detection-flush-timer" – flushes a partial batch once the batch interval has elapsed
 *
 * "detection-dispatch" – forwards flushed batches one at a time, in flush order, so a
 * slow detection call never stalls the receive loop
 *
 * Shutdown is ordered: stop the source, join the receiver, close the batcher (final
 * flush), drain the dispatcher, then log the run summary. An authentication failure
 * stops the source and terminates the application; so does the end of a finite source.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DetectionPipeline {

    public static final int EXIT_SOURCE_FAILED = 1;
    public static final int EXIT_AUTH_FAILED = 2;

    private final RecordSource source;
    private final Forwarder forwarder;
    private final PipelineStats stats;
    private final ApplicationTerminator terminator;
    private final List<BatchResultListener> listeners;
    private final BatchSettings batchSettings;

    private final ExecutorService dispatcher =
            Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "detection-dispatch");
                t.setDaemon(true);
                return t;
            });

    private final AtomicBoolean shutdownStarted = new AtomicBoolean();
    private volatile boolean stopping;
    private Batcher<CanonicalRecord> batcher;
    private Thread receiver;

    @PostConstruct
    public void start() {
        log.info("Starting detection pipeline. source={} batchSize={} interval={}ms",
                source.describe(), batchSettings.getMaxSize(), batchSettings.getInterval().toMillis());

        batcher = new Batcher<>("detection", batchSettings.getMaxSize(), batchSettings.getInterval(), this::dispatch);
        batcher.start(batchSettings.getTick());

        // non-daemon: keeps a process without a web server alive while input flows
        receiver = new Thread(this::receive, "feed-receiver");
        receiver.start();
    }

    @PreDestroy
    public void shutdown() {
        if (!shutdownStarted.compareAndSet(false, true)) {
            return;
        }
        stopping = true;
        log.info("Shutting down detection pipeline");

        source.stop();
        joinReceiver();

        // final flush goes through the dispatcher like any other batch
        batcher.close();

        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(batchSettings.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("In-flight batch did not complete within {}s; abandoning it",
                        batchSettings.getShutdownGrace().toSeconds());
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }

        logSummary();
    }

    private void receive() {
        int exitCode = 0;
        String reason;
        try {
            source.run(this::accept);
            reason = "record source '" + source.describe() + "' finished";
        } catch (RuntimeException e) {
            log.error("Record source '{}' failed", source.describe(), e);
            exitCode = EXIT_SOURCE_FAILED;
            reason = "record source failed: " + e.getMessage();
        }
        if (!stopping) {
            terminator.terminate(exitCode, reason);
        }
    }

    private void accept(CanonicalRecord record) {
        stats.recordAccepted();
        batcher.submit(record);
    }

    private void dispatch(List<CanonicalRecord> batch) {
        try {
            dispatcher.execute(() -> forwardBatch(batch));
        } catch (RejectedExecutionException e) {
            log.warn("Dispatcher already stopped; batch of {} events not forwarded", batch.size());
        }
    }

    private void forwardBatch(List<CanonicalRecord> batch) {
        ForwardResult result = forwarder.forward(batch);

        for (BatchResultListener listener : listeners) {
            try {
                listener.onResult(batch, result);
            } catch (RuntimeException e) {
                log.warn("Batch result listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }

        if (result.getStatus() == ForwardResult.Status.AUTH_FAILED) {
            log.error("Detection API rejected the API key; stopping pipeline");
            // terminate before stopping the source so its end is not reported as a clean exit
            if (!stopping) {
                terminator.terminate(EXIT_AUTH_FAILED, "detection API authentication failed");
            }
            source.stop();
        }
    }

    private void joinReceiver() {
        if (receiver == null || receiver == Thread.currentThread()) {
            return;
        }
        try {
            receiver.join(batchSettings.getShutdownGrace().toMillis());
            if (receiver.isAlive()) {
                log.warn("Receiver thread still blocked after {}s; continuing shutdown",
                        batchSettings.getShutdownGrace().toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void logSummary() {
        ForwarderStats.Snapshot forwarded = forwarder.getStats().snapshot();
        double rate = forwarded.getEventsForwarded() == 0
                ? 0.0
                : 100.0 * forwarded.getAnomaliesDetected() / forwarded.getEventsForwarded();

        log.info("---- Run summary ----");
        log.info("Total events processed: {}", forwarded.getEventsForwarded());
        log.info("Total anomalies detected: {}", forwarded.getAnomaliesDetected());
        log.info("Anomaly rate: {}%", String.format(Locale.ROOT, "%.2f", rate));
        log.info("Records accepted: {}, malformed: {}, batches sent: {}, dropped: {}",
                stats.getRecordsAccepted(), stats.getMalformed(),
                forwarded.getBatchesSent(), forwarded.getBatchesDropped());
    }
}
