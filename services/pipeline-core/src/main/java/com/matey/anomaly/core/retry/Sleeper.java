package com.matey.anomaly.core.retry;

import java.time.Duration;

/**
 * Waits between retry attempts. Swapped out in tests so backoff sequences can be
 * recorded instead of slept through.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
