package com.matey.anomaly.detector.pipeline;

import com.matey.anomaly.core.model.CanonicalRecord;

import java.util.function.Consumer;

/**
 * Where the pipeline's canonical records come from.
 */
public interface RecordSource {

    /**
     * Delivers records to the sink on the calling thread until the input is exhausted or
     * {@link #stop()} is called.
     */
    void run(Consumer<CanonicalRecord> sink);

    void stop();

    String describe();
}
