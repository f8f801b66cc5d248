package com.matey.anomaly.detector.pipeline;

import com.matey.anomaly.core.forward.ForwardResult;
import com.matey.anomaly.core.model.CanonicalRecord;

import java.util.List;

/**
 * Called on the dispatcher thread after each batch has been forwarded.
 */
public interface BatchResultListener {

    void onResult(List<CanonicalRecord> batch, ForwardResult result);
}
