package com.matey.anomaly.core.batch;

import java.util.List;

@FunctionalInterface
public interface BatchSink<T> {

    void accept(List<T> batch);
}
