package com.matey.anomaly.detector.pipeline;

import lombok.Value;

import java.time.Duration;

@Value
public class BatchSettings {

    int maxSize;
    Duration interval;
    /** How often the flush timer checks the interval trigger. */
    Duration tick;
    /** Upper bound for each shutdown wait (receiver join, in-flight dispatch). */
    Duration shutdownGrace;
}
