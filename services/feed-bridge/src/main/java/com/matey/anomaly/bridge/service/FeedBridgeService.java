package com.matey.anomaly.bridge.service;

import com.matey.anomaly.core.feed.FeedClient;
import com.matey.anomaly.core.io.NdjsonWriter;
import com.matey.anomaly.core.lifecycle.ApplicationTerminator;
import com.matey.anomaly.core.model.CanonicalRecord;
import com.matey.anomaly.core.normalize.RawMessageNormalizer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pumps the configured feed to stdout.
 *
 * Every raw message is normalized; each resulting record is written as one JSON line
 * and flushed immediately. Messages that do not normalize (subscription noise, other
 * event types, malformed payloads) are counted and skipped. When the reader of stdout
 * goes away the connector is stopped and the application exits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedBridgeService {

    public static final int EXIT_OUTPUT_CLOSED = 1;

    private final FeedClient connector;
    private final RawMessageNormalizer normalizer;
    private final NdjsonWriter writer;
    private final ApplicationTerminator terminator;

    @Value("${app.bridge.health-log-every:100}")
    private long healthLogEvery = 100;

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong emitted = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();

    private volatile boolean outputClosed;
    private volatile boolean stopping;
    private Thread pump;

    @PostConstruct
    public void start() {
        log.info("Starting feed bridge");
        pump = new Thread(this::pump, "feed-bridge");
        pump.start();
    }

    @PreDestroy
    public void stop() {
        stopping = true;
        connector.stop();
        if (pump != null && pump != Thread.currentThread()) {
            try {
                pump.join(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Feed bridge stopped. received={} emitted={} skipped={}", received.get(), emitted.get(), skipped.get());
    }

    private void pump() {
        connector.run(this::handle);
        if (!stopping) {
            terminator.terminate(outputClosed ? EXIT_OUTPUT_CLOSED : 0, "feed connector stopped");
        }
    }

    /**
     * Normalizes one raw feed message and writes its records, if any. A single message
     * may carry several records (Kraken trade batches, price snapshots).
     */
    void handle(String raw) {
        if (outputClosed) {
            return;
        }
        received.incrementAndGet();
        List<CanonicalRecord> records = normalizer.normalizeAll(raw);
        if (records.isEmpty()) {
            skipped.incrementAndGet();
            return;
        }
        for (CanonicalRecord record : records) {
            if (!writer.write(record)) {
                outputClosed = true;
                log.error("stdout closed by reader; stopping feed bridge");
                connector.stop();
                return;
            }
            long count = emitted.incrementAndGet();
            if (healthLogEvery > 0 && count % healthLogEvery == 0) {
                log.info("Health: {} records emitted ({} messages skipped)", count, skipped.get());
            }
        }
    }

    public long getEmitted() {
        return emitted.get();
    }

    public long getSkipped() {
        return skipped.get();
    }
}
