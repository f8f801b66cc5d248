package com.matey.anomaly.core.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Capped exponential backoff.
 *
 * <p>Pure and stateless: callers own the current delay and ask for the next one, so the
 * sequence can be checked without any I/O. Starting from {@link #initial()} the delay
 * doubles on every call to {@link #next(Duration)} until it reaches {@link #max()}.</p>
 */
public final class BackoffPolicy {

    private final Duration initial;
    private final Duration max;

    private BackoffPolicy(Duration initial, Duration max) {
        this.initial = Objects.requireNonNull(initial, "initial");
        this.max = Objects.requireNonNull(max, "max");
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("Initial backoff must be positive: " + initial);
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Max backoff " + max + " is below initial " + initial);
        }
    }

    public static BackoffPolicy exponential(Duration initial, Duration max) {
        return new BackoffPolicy(initial, max);
    }

    public Duration initial() {
        return initial;
    }

    public Duration max() {
        return max;
    }

    public Duration next(Duration current) {
        if (current == null || current.compareTo(initial) < 0) {
            return initial;
        }
        if (current.compareTo(max.dividedBy(2)) > 0) {
            return max;
        }
        return current.multipliedBy(2);
    }

    @Override
    public String toString() {
        return "BackoffPolicy{initial=" + initial + ", max=" + max + '}';
    }
}
