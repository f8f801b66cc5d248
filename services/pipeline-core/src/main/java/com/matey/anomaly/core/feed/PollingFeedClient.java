package com.matey.anomaly.core.feed;

import com.matey.anomaly.core.retry.BackoffPolicy;
import com.matey.anomaly.core.retry.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Polls an HTTP endpoint (CoinGecko prices) at a fixed interval and hands each response
 * body to the handler. A failed poll, rate limiting included, is retried after the
 * current backoff delay instead of the interval; a good poll resets the delay.
 */
@Slf4j
public class PollingFeedClient implements FeedClient {

    private final RestTemplate restTemplate;
    private final URI uri;
    private final HttpHeaders headers;
    private final Duration interval;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;

    private final AtomicBoolean started = new AtomicBoolean();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicLong polls = new AtomicLong();
    private volatile boolean stopRequested;
    private volatile Duration retryDelay;

    /**
     * @param sleeper waits between polls; null waits on the stop signal
     */
    public PollingFeedClient(RestTemplate restTemplate, URI uri, HttpHeaders headers, Duration interval,
                             BackoffPolicy backoff, Sleeper sleeper) {
        this.restTemplate = restTemplate;
        this.uri = uri;
        this.headers = headers;
        this.interval = interval;
        this.backoff = backoff;
        this.sleeper = sleeper != null
                ? sleeper
                : d -> stopSignal.await(d.toMillis(), TimeUnit.MILLISECONDS);
        this.retryDelay = backoff.initial();
    }

    @Override
    public void run(Consumer<String> handler) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Polling client already started");
        }
        log.info("Starting poller. uri={} interval={}ms", uri, interval.toMillis());
        while (!stopRequested) {
            Duration wait;
            try {
                ResponseEntity<String> response =
                        restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
                retryDelay = backoff.initial();
                polls.incrementAndGet();
                if (response.getBody() != null) {
                    handler.accept(response.getBody());
                }
                wait = interval;
            } catch (RestClientResponseException e) {
                wait = retryDelay;
                log.warn("Poll failed. status={} retryIn={}s", e.getStatusCode().value(), wait.toSeconds());
                retryDelay = backoff.next(wait);
            } catch (RestClientException e) {
                wait = retryDelay;
                log.warn("Poll failed: {}. retryIn={}s", e.getMessage(), wait.toSeconds());
                retryDelay = backoff.next(wait);
            }
            if (stopRequested) {
                break;
            }
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Poller stopped. uri={} polls={}", uri, polls.get());
    }

    @Override
    public void stop() {
        if (!stopRequested) {
            log.info("Stop requested for poller");
        }
        stopRequested = true;
        stopSignal.countDown();
    }

    public long getPolls() {
        return polls.get();
    }
}
