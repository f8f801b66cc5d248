package com.matey.anomaly.core.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.retry.BackoffPolicy;
import com.matey.anomaly.core.retry.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Keeps a subscription to the upstream feed alive and hands every raw message to a
 * handler.
 *
 * <p>The connector is a small state machine driven by {@link #run(Consumer)} on the
 * caller's thread:</p>
 * <ul>
 *     <li>CONNECTING: open the transport</li>
 *     <li>SUBSCRIBED: subscribe request sent, waiting for the first frame</li>
 *     <li>STREAMING: data frames flowing, reconnect delay reset to the floor</li>
 *     <li>RECONNECTING: waiting out the current delay after a transport failure</li>
 * </ul>
 *
 * <p>Control frames of the {@link SubscriptionProtocol} (acknowledgements, error replies,
 * heartbeats) are consumed here, never reach the handler and do not count as
 * streaming.
 * {@link #stop()} is observed within one poll interval, including while waiting to
 * reconnect. A connector runs once; it is not restartable.</p>
 */
@Slf4j
public class FeedConnector implements FeedClient {

    private final URI uri;
    private final List<String> topics;
    private final FeedTransport transport;
    private final BackoffPolicy backoff;
    private final SubscriptionProtocol protocol;
    private final Duration pollInterval;
    private final Duration idleTimeout;
    private final Sleeper sleeper;

    private final AtomicLong requestIds = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile boolean stopRequested;

    private final Object stateLock = new Object();
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Duration reconnectDelay;

    public FeedConnector(URI uri,
                         List<String> topics,
                         FeedTransport transport,
                         BackoffPolicy backoff,
                         ObjectMapper objectMapper,
                         Duration pollInterval,
                         Duration idleTimeout) {
        this(uri, topics, transport, backoff, objectMapper, pollInterval, idleTimeout, null);
    }

    public FeedConnector(URI uri,
                         List<String> topics,
                         FeedTransport transport,
                         BackoffPolicy backoff,
                         ObjectMapper objectMapper,
                         Duration pollInterval,
                         Duration idleTimeout,
                         Sleeper sleeper) {
        this(uri, topics, transport, backoff, new BinanceSubscriptionProtocol(objectMapper),
                pollInterval, idleTimeout, sleeper);
    }

    /**
     * @param idleTimeout silence after which the connection is treated as dead; zero disables
     * @param sleeper     waits between reconnects; null waits on the stop signal so that
     *                    {@link #stop()} cuts a reconnect delay short
     */
    public FeedConnector(URI uri,
                         List<String> topics,
                         FeedTransport transport,
                         BackoffPolicy backoff,
                         SubscriptionProtocol protocol,
                         Duration pollInterval,
                         Duration idleTimeout,
                         Sleeper sleeper) {
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("At least one subscription topic is required");
        }
        this.uri = uri;
        this.topics = List.copyOf(topics);
        this.transport = transport;
        this.backoff = backoff;
        this.protocol = protocol;
        this.pollInterval = pollInterval;
        this.idleTimeout = idleTimeout == null ? Duration.ZERO : idleTimeout;
        this.sleeper = sleeper != null
                ? sleeper
                : d -> stopSignal.await(d.toMillis(), TimeUnit.MILLISECONDS);
        this.reconnectDelay = backoff.initial();
    }

    /**
     * Connects, subscribes and streams until {@link #stop()} is called. Transport
     * failures never escape; they lead to a reconnect after the current backoff delay.
     */
    @Override
    public void run(Consumer<String> handler) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Feed connector already started");
        }
        log.info("Starting feed connector. uri={} topics={}", uri, topics);
        try {
            while (!stopRequested) {
                try {
                    streamOnce(handler);
                } catch (FeedTransportException e) {
                    if (stopRequested) {
                        break;
                    }
                    Duration delay = reconnectDelay;
                    transition(ConnectionState.RECONNECTING);
                    log.warn("Feed connection failed: {}. Reconnecting in {}s", e.getMessage(), delay.toSeconds());
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        stopRequested = true;
                        break;
                    }
                    reconnectDelay = backoff.next(delay);
                }
            }
        } finally {
            transition(ConnectionState.DISCONNECTED);
            log.info("Feed connector stopped. uri={}", uri);
        }
    }

    @Override
    public void stop() {
        if (!stopRequested) {
            log.info("Stop requested for feed connector");
        }
        stopRequested = true;
        stopSignal.countDown();
    }

    public ConnectionState getState() {
        return state;
    }

    /**
     * Delay the connector waits (or will wait) before its next reconnect attempt.
     */
    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    private void streamOnce(Consumer<String> handler) throws FeedTransportException {
        transition(ConnectionState.CONNECTING);
        long requestId = requestIds.incrementAndGet();
        BlockingQueue<FeedFrame> inbox = new LinkedBlockingQueue<>();

        try (FeedSession session = transport.connect(uri, inbox)) {
            session.send(protocol.subscribeRequest(topics, requestId));
            transition(ConnectionState.SUBSCRIBED);
            log.info("Subscribed to {} streams. id={}", topics.size(), requestId);

            long lastFrameNanos = System.nanoTime();
            while (!stopRequested) {
                FeedFrame frame;
                try {
                    frame = inbox.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    stopRequested = true;
                    return;
                }

                if (frame == null) {
                    if (!idleTimeout.isZero() && System.nanoTime() - lastFrameNanos >= idleTimeout.toNanos()) {
                        throw new FeedTransportException("No data received for " + idleTimeout.toSeconds() + "s");
                    }
                    continue;
                }
                lastFrameNanos = System.nanoTime();

                switch (frame.kind()) {
                    case CLOSED -> throw new FeedTransportException("Connection closed: " + frame.payload());
                    case ERROR -> throw new FeedTransportException("Transport error: " + frame.payload(), frame.error());
                    case TEXT -> {
                        if (!protocol.isControlFrame(frame.payload(), requestId)) {
                            markStreaming();
                            handler.accept(frame.payload());
                        }
                    }
                }
            }
        }
    }

    private void markStreaming() {
        if (state == ConnectionState.STREAMING) {
            return;
        }
        transition(ConnectionState.STREAMING);
        reconnectDelay = backoff.initial();
        log.info("Feed streaming. uri={}", uri);
    }

    private void transition(ConnectionState next) {
        synchronized (stateLock) {
            if (state != next) {
                log.debug("Feed connection {} -> {}", state, next);
                state = next;
            }
        }
    }
}
