package com.matey.anomaly.core.feed;

import com.matey.anomaly.core.retry.BackoffPolicy;
import com.matey.anomaly.core.retry.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Reads a Server-Sent Events stream (Wikimedia EventStreams and the like) and hands the
 * {@code data} of every event to the handler. Multi-line data is joined with newlines;
 * comments and other fields are ignored.
 *
 * The server ending the stream, an HTTP error or a read timeout all lead to a reconnect
 * after the current backoff delay; the delay resets once an event arrives.
 */
@Slf4j
public class SseFeedClient implements FeedClient {

    private final RestTemplate restTemplate;
    private final URI uri;
    private final String userAgent;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;

    private final AtomicBoolean started = new AtomicBoolean();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile boolean stopRequested;
    private volatile InputStream currentStream;
    private volatile Duration reconnectDelay;

    /**
     * @param restTemplate its read timeout doubles as the idle timeout of the stream
     * @param sleeper      waits between reconnects; null waits on the stop signal
     */
    public SseFeedClient(RestTemplate restTemplate, URI uri, String userAgent, BackoffPolicy backoff, Sleeper sleeper) {
        this.restTemplate = restTemplate;
        this.uri = uri;
        this.userAgent = userAgent;
        this.backoff = backoff;
        this.sleeper = sleeper != null
                ? sleeper
                : d -> stopSignal.await(d.toMillis(), TimeUnit.MILLISECONDS);
        this.reconnectDelay = backoff.initial();
    }

    @Override
    public void run(Consumer<String> handler) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("SSE client already started");
        }
        log.info("Starting event stream client. uri={}", uri);
        while (!stopRequested) {
            try {
                log.info("Connecting to {}", uri);
                restTemplate.execute(uri, HttpMethod.GET,
                        request -> {
                            request.getHeaders().setAccept(List.of(MediaType.TEXT_EVENT_STREAM));
                            request.getHeaders().set(HttpHeaders.USER_AGENT, userAgent);
                        },
                        response -> {
                            readEvents(response.getBody(), handler);
                            return null;
                        });
                if (stopRequested) {
                    break;
                }
                log.warn("Event stream ended by server. uri={}", uri);
            } catch (RestClientException e) {
                if (stopRequested) {
                    break;
                }
                log.warn("Event stream failed: {}", e.getMessage());
            }

            Duration delay = reconnectDelay;
            log.info("Reconnecting in {}s", delay.toSeconds());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            reconnectDelay = backoff.next(delay);
        }
        log.info("Event stream client stopped. uri={}", uri);
    }

    @Override
    public void stop() {
        if (!stopRequested) {
            log.info("Stop requested for event stream client");
        }
        stopRequested = true;
        stopSignal.countDown();
        InputStream stream = currentStream;
        if (stream != null) {
            try {
                stream.close();
            } catch (IOException e) {
                log.debug("Closing event stream on stop failed: {}", e.getMessage());
            }
        }
    }

    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    private void readEvents(InputStream body, Consumer<String> handler) throws IOException {
        currentStream = body;
        boolean streaming = false;
        StringBuilder data = new StringBuilder();
        try (BufferedReader lines = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
            String line;
            while (!stopRequested && (line = lines.readLine()) != null) {
                if (line.isEmpty()) {
                    if (data.length() > 0) {
                        if (!streaming) {
                            streaming = true;
                            reconnectDelay = backoff.initial();
                            log.info("Event stream flowing. uri={}", uri);
                        }
                        handler.accept(data.toString());
                        data.setLength(0);
                    }
                } else if (line.startsWith("data:")) {
                    if (data.length() > 0) {
                        data.append('\n');
                    }
                    String value = line.substring(5);
                    data.append(value.startsWith(" ") ? value.substring(1) : value);
                }
            }
        } catch (IOException e) {
            if (!stopRequested) {
                throw e;
            }
        } finally {
            currentStream = null;
        }
    }
}
