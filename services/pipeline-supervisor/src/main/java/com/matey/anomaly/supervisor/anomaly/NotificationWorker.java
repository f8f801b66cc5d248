package com.matey.anomaly.supervisor.anomaly;

import com.fasterxml.jackson.databind.JsonNode;
import com.matey.anomaly.core.batch.Batcher;
import com.matey.anomaly.core.notify.NotificationClient;
import com.matey.anomaly.supervisor.metrics.SupervisorMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Consumes the anomaly queue on its own thread and posts anomalies to the notification
 * endpoint in batches: when {@code batchSize} have accumulated, or when the batch
 * timeout has passed since the last send. The queue is polled with a short timeout so
 * a partial batch still goes out on time while the queue is quiet.
 *
 * Each anomaly gets one delivery attempt. {@link #stop()} drains the queue and flushes
 * whatever is left.
 */
@Slf4j
public class NotificationWorker {

    private final BlockingQueue<JsonNode> queue;
    private final NotificationClient client;
    private final SupervisorMetrics metrics;
    private final Duration pollTimeout;
    private final Duration stopTimeout;
    private final Batcher<JsonNode> batcher;

    private volatile boolean running;
    private Thread thread;

    public NotificationWorker(BlockingQueue<JsonNode> queue,
                              NotificationClient client,
                              SupervisorMetrics metrics,
                              int batchSize,
                              Duration batchTimeout,
                              Duration pollTimeout,
                              Duration stopTimeout,
                              Clock clock) {
        this.queue = queue;
        this.client = client;
        this.metrics = metrics;
        this.pollTimeout = pollTimeout;
        this.stopTimeout = stopTimeout;
        this.batcher = new Batcher<>("notification", batchSize, batchTimeout, this::send, clock);
    }

    public synchronized void start() {
        if (thread != null) {
            return;
        }
        running = true;
        thread = new Thread(this::consume, "notification-worker");
        thread.setDaemon(true);
        thread.start();
        log.info("Notification worker started");
    }

    public void stop() {
        Thread worker;
        synchronized (this) {
            running = false;
            worker = thread;
        }
        if (worker != null && worker != Thread.currentThread()) {
            try {
                worker.join(stopTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        List<JsonNode> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        remaining.forEach(batcher::submit);
        batcher.close();
        log.info("Notification worker stopped");
    }

    private void consume() {
        while (running) {
            try {
                JsonNode anomaly = queue.poll(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (anomaly != null) {
                    batcher.submit(anomaly);
                }
                batcher.flushIfDue();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Error in notification worker", e);
            }
        }
    }

    private void send(List<JsonNode> batch) {
        boolean delivered = client.send(batch);
        metrics.recordNotification(batch.size(), delivered);
    }
}
