package com.matey.anomaly.core.batch;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Groups items into batches with a dual trigger: a batch is flushed to the sink as soon
 * as it holds {@code maxSize} items, or once {@code interval} has elapsed since the last
 * flush and it is non-empty.
 *
 * <p>The time trigger is checked on every submit and either by an internal timer
 * ({@link #start(Duration)}) or by a caller polling {@link #flushIfDue()}. Items keep
 * their arrival order and each accepted item lands in exactly one batch.
 * {@link #close()} flushes the remainder exactly once; later submits are refused.</p>
 *
 * <p>The sink runs on the flushing thread while the batcher lock is held; submits from
 * other threads wait until it returns.</p>
 */
@Slf4j
public class Batcher<T> implements AutoCloseable {

    private final String name;
    private final int maxSize;
    private final Duration interval;
    private final BatchSink<T> sink;
    private final Clock clock;

    private final List<T> pending = new ArrayList<>();
    private Instant lastFlush;
    private boolean closed;
    private ScheduledExecutorService timer;

    public Batcher(String name, int maxSize, Duration interval, BatchSink<T> sink) {
        this(name, maxSize, interval, sink, Clock.systemUTC());
    }

    public Batcher(String name, int maxSize, Duration interval, BatchSink<T> sink, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + maxSize);
        }
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Batch interval must be positive: " + interval);
        }
        this.name = name;
        this.maxSize = maxSize;
        this.interval = interval;
        this.sink = sink;
        this.clock = clock;
        this.lastFlush = clock.instant();
    }

    /**
     * Starts a daemon timer that checks the time trigger every {@code tick}.
     */
    public synchronized void start(Duration tick) {
        if (closed) {
            throw new IllegalStateException("Batcher '" + name + "' is closed");
        }
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name + "-flush-timer");
            t.setDaemon(true);
            return t;
        });
        long tickMillis = Math.max(1L, tick.toMillis());
        timer.scheduleAtFixedRate(this::timerTick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        log.debug("Batcher '{}' timer started. maxSize={} interval={}ms tick={}ms",
                name, maxSize, interval.toMillis(), tickMillis);
    }

    /**
     * @return false if the batcher is already closed and the item was not accepted
     */
    public synchronized boolean submit(T item) {
        if (closed) {
            log.warn("Batcher '{}' is closed; rejecting item", name);
            return false;
        }
        pending.add(item);
        if (pending.size() >= maxSize) {
            flush("size");
        } else {
            flushIfDue();
        }
        return true;
    }

    public synchronized void flushIfDue() {
        if (!pending.isEmpty() && !clock.instant().isBefore(lastFlush.plus(interval))) {
            flush("interval");
        }
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        ScheduledExecutorService toStop;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toStop = timer;
            timer = null;
            if (!pending.isEmpty()) {
                flush("shutdown");
            }
        }
        if (toStop != null) {
            toStop.shutdownNow();
        }
        log.debug("Batcher '{}' closed", name);
    }

    private void timerTick() {
        try {
            flushIfDue();
        } catch (Exception e) {
            log.warn("Batcher '{}' timer flush failed", name, e);
        }
    }

    private void flush(String trigger) {
        List<T> batch = Collections.unmodifiableList(new ArrayList<>(pending));
        pending.clear();
        lastFlush = clock.instant();
        log.debug("Batcher '{}' flushing {} items. trigger={}", name, batch.size(), trigger);
        sink.accept(batch);
    }
}
