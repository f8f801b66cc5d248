package com.matey.anomaly.core.normalize;

import com.matey.anomaly.core.model.CanonicalRecord;

import java.util.List;
import java.util.Optional;

/**
 * Turns one raw upstream message into a canonical record. Implementations never throw:
 * anything unrecognized or malformed yields {@link Optional#empty()}.
 */
public interface RawMessageNormalizer {

    Optional<CanonicalRecord> normalize(String raw);

    /**
     * All records carried by one raw message, in upstream order. Schemas that pack
     * several events into one message (trade arrays, price snapshots) override this;
     * an empty list means the message was skipped.
     */
    default List<CanonicalRecord> normalizeAll(String raw) {
        return normalize(raw).map(List::of).orElse(List.of());
    }
}
