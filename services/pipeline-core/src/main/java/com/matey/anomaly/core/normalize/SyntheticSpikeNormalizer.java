package com.matey.anomaly.core.normalize;

import com.matey.anomaly.core.model.CanonicalRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Demo aid: after every {@code every}-th trade, adds a copy of that trade with ten times
 * the quantity, one millisecond later, id {@code SYNTH_<n>} and {@code synthetic: true},
 * so a quiet market still produces something for the detector to flag. Records without
 * a numeric {@code quantity} pass through and are not counted.
 */
@Slf4j
public class SyntheticSpikeNormalizer implements RawMessageNormalizer {

    static final double SPIKE_FACTOR = 10.0;

    private final RawMessageNormalizer delegate;
    private final long every;
    private final AtomicLong trades = new AtomicLong();
    private final AtomicLong injected = new AtomicLong();

    public SyntheticSpikeNormalizer(RawMessageNormalizer delegate, long every) {
        if (every <= 0) {
            throw new IllegalArgumentException("Spike interval must be positive: " + every);
        }
        this.delegate = delegate;
        this.every = every;
    }

    /**
     * Passes through without injecting; spikes are added on {@link #normalizeAll(String)}.
     */
    @Override
    public Optional<CanonicalRecord> normalize(String raw) {
        return delegate.normalize(raw);
    }

    @Override
    public List<CanonicalRecord> normalizeAll(String raw) {
        List<CanonicalRecord> records = delegate.normalizeAll(raw);
        if (records.isEmpty()) {
            return records;
        }
        List<CanonicalRecord> out = new ArrayList<>(records.size() + 1);
        for (CanonicalRecord record : records) {
            out.add(record);
            if (!(record.get("quantity") instanceof Number)) {
                continue;
            }
            long count = trades.incrementAndGet();
            if (count % every == 0) {
                out.add(spike(record, count));
                log.info("Injected synthetic spike after trade {}. total={}", count, injected.incrementAndGet());
            }
        }
        return out;
    }

    public long getInjected() {
        return injected.get();
    }

    private static CanonicalRecord spike(CanonicalRecord trade, long count) {
        double quantity = ((Number) trade.get("quantity")).doubleValue() * SPIKE_FACTOR;
        Map<String, Object> fields = new LinkedHashMap<>(trade.asMap());
        fields.put(CanonicalRecord.TIMESTAMP, trade.getTimestamp().plusMillis(1).toString());
        fields.put(CanonicalRecord.ID, "SYNTH_" + count);
        fields.put("quantity", quantity);
        Object price = trade.get("price");
        if (price instanceof Number) {
            double unitPrice = ((Number) price).doubleValue();
            fields.put("volume_usd", unitPrice * quantity);
            Object side = trade.get("side");
            if (side instanceof String) {
                fields.put(CanonicalRecord.MESSAGE,
                        TradeMessages.describe((String) side, quantity, trade.getSymbol(), unitPrice));
            }
        }
        fields.put("synthetic", true);
        return CanonicalRecord.of(fields);
    }
}
