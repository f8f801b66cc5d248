package com.matey.anomaly.detector.pipeline;

import com.matey.anomaly.core.feed.FeedClient;
import com.matey.anomaly.core.model.CanonicalRecord;
import com.matey.anomaly.core.normalize.RawMessageNormalizer;
import com.matey.anomaly.detector.metrics.PipelineStats;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.function.Consumer;

/**
 * Records normalized straight from the configured feed. Runs until stopped; the client
 * reconnects on its own.
 */
@RequiredArgsConstructor
public class FeedRecordSource implements RecordSource {

    private final FeedClient connector;
    private final RawMessageNormalizer normalizer;
    private final PipelineStats stats;

    @Override
    public void run(Consumer<CanonicalRecord> sink) {
        connector.run(raw -> {
            stats.recordReceived();
            List<CanonicalRecord> records = normalizer.normalizeAll(raw);
            if (records.isEmpty()) {
                stats.recordMalformed();
            } else {
                records.forEach(sink);
            }
        });
    }

    @Override
    public void stop() {
        connector.stop();
    }

    @Override
    public String describe() {
        return "feed";
    }
}
