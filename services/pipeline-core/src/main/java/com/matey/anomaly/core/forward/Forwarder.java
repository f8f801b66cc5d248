package com.matey.anomaly.core.forward;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.model.AnomalyRecord;
import com.matey.anomaly.core.model.CanonicalRecord;
import com.matey.anomaly.core.model.DetectionRequest;
import com.matey.anomaly.core.model.DetectionResponse;
import com.matey.anomaly.core.retry.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Sends batches of canonical records to the detection service ({@code POST <api>/detect})
 * and classifies the outcome.
 *
 * <ul>
 *     <li>2xx: anomalies parsed from the body (absent means none)</li>
 *     <li>401/403: credentials rejected, the forwarder halts for good and refuses every
 *     later batch without sending it</li>
 *     <li>429: the same batch is resent after a rate-limit cool-off</li>
 *     <li>other 4xx/5xx and unreadable bodies: dropped, or retried under
 *     {@link FailurePolicy#RETRY}</li>
 *     <li>network errors: retried up to the attempt limit, then dropped</li>
 * </ul>
 *
 * Not thread-safe for concurrent batches; callers forward one batch at a time.
 */
@Slf4j
public class Forwarder {

    public static final String API_KEY_HEADER = "X-Api-Key";

    private static final int MAX_LOGGED_EXPLANATIONS = 3;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String detectUrl;
    private final String apiKey;
    private final DetectionSettings detectionSettings;
    private final RetrySettings retrySettings;
    private final Sleeper sleeper;

    private final ForwarderStats stats = new ForwarderStats();
    private volatile boolean halted;

    public Forwarder(RestTemplate restTemplate,
                     ObjectMapper objectMapper,
                     String apiUrl,
                     String apiKey,
                     DetectionSettings detectionSettings,
                     RetrySettings retrySettings,
                     Sleeper sleeper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.detectUrl = stripTrailingSlash(apiUrl) + "/detect";
        this.apiKey = apiKey;
        this.detectionSettings = detectionSettings;
        this.retrySettings = retrySettings;
        this.sleeper = sleeper;
    }

    public ForwardResult forward(List<CanonicalRecord> batch) {
        if (halted) {
            log.warn("Forwarder halted after authentication failure; refusing batch of {} events", batch.size());
            return ForwardResult.halted();
        }
        if (batch.isEmpty()) {
            return ForwardResult.success(List.of(), 0);
        }

        HttpEntity<String> request;
        try {
            request = new HttpEntity<>(objectMapper.writeValueAsString(toRequest(batch)), headers());
        } catch (JsonProcessingException e) {
            log.error("Cannot encode detection request for {} events", batch.size(), e);
            stats.recordDropped(batch.size());
            return ForwardResult.dropped(null, 0);
        }

        int attempt = 0;
        int rateLimitRetries = 0;
        Duration retryDelay = retrySettings.getRetryBackoff().initial();
        Duration coolOff = retrySettings.getRateLimitBackoff().initial();

        while (true) {
            attempt++;
            long start = System.nanoTime();
            try {
                ResponseEntity<String> response = restTemplate.exchange(detectUrl, HttpMethod.POST, request, String.class);
                stats.recordLatency(elapsedMicros(start));
                List<AnomalyRecord> anomalies = parseAnomalies(response.getBody());
                stats.recordSuccess(batch.size(), anomalies.size());
                logAnomalies(batch.size(), anomalies);
                return ForwardResult.success(anomalies, attempt);

            } catch (RestClientResponseException e) {
                stats.recordLatency(elapsedMicros(start));
                int status = e.getStatusCode().value();
                String body = e.getResponseBodyAsString();

                if (status == 401 || status == 403) {
                    halted = true;
                    stats.recordDropped(batch.size());
                    log.error("Detection API rejected credentials. status={} batch={}; halting forwarder", status, batch.size());
                    return ForwardResult.authFailed(status, attempt);
                }

                if (status == 429) {
                    stats.recordRateLimited();
                    int maxRateLimitRetries = retrySettings.getMaxRateLimitRetries();
                    if (maxRateLimitRetries > 0 && rateLimitRetries >= maxRateLimitRetries) {
                        return drop(batch, status, attempt, "rate limit persisted after " + rateLimitRetries + " retries");
                    }
                    rateLimitRetries++;
                    log.warn("Detection API rate limited. status={} batch={}; resending in {}s",
                            status, batch.size(), coolOff.toSeconds());
                    if (!pause(coolOff)) {
                        return drop(batch, status, attempt, "interrupted during rate-limit cool-off");
                    }
                    coolOff = retrySettings.getRateLimitBackoff().next(coolOff);
                    attempt--;
                    continue;
                }

                log.warn("Detection API error. status={} bytes={} batch={} body={}",
                        status, body.getBytes(StandardCharsets.UTF_8).length, batch.size(), abbreviate(body));
                if (retrySettings.getFailurePolicy() == FailurePolicy.RETRY && attempt < retrySettings.getMaxAttempts()) {
                    if (!retryAfter(retryDelay, attempt)) {
                        return drop(batch, status, attempt, "interrupted while waiting to retry");
                    }
                    retryDelay = retrySettings.getRetryBackoff().next(retryDelay);
                    continue;
                }
                return drop(batch, status, attempt, "status " + status);

            } catch (ResourceAccessException e) {
                log.warn("Detection API unreachable (attempt {}/{}): {}", attempt, retrySettings.getMaxAttempts(), e.getMessage());
                if (attempt < retrySettings.getMaxAttempts()) {
                    if (!retryAfter(retryDelay, attempt)) {
                        return drop(batch, null, attempt, "interrupted while waiting to retry");
                    }
                    retryDelay = retrySettings.getRetryBackoff().next(retryDelay);
                    continue;
                }
                return drop(batch, null, attempt, "network error: " + e.getMessage());

            } catch (JsonProcessingException | RestClientException e) {
                log.warn("Unreadable detection response for batch of {}: {}", batch.size(), e.getMessage());
                if (retrySettings.getFailurePolicy() == FailurePolicy.RETRY && attempt < retrySettings.getMaxAttempts()) {
                    if (!retryAfter(retryDelay, attempt)) {
                        return drop(batch, null, attempt, "interrupted while waiting to retry");
                    }
                    retryDelay = retrySettings.getRetryBackoff().next(retryDelay);
                    continue;
                }
                return drop(batch, null, attempt, "malformed response");
            }
        }
    }

    public boolean isHalted() {
        return halted;
    }

    public ForwarderStats getStats() {
        return stats;
    }

    private DetectionRequest toRequest(List<CanonicalRecord> batch) {
        return new DetectionRequest(
                batch,
                detectionSettings.getWindowSize(),
                detectionSettings.getBaselineLines(),
                detectionSettings.getNcdThreshold(),
                detectionSettings.getPValueThreshold()
        );
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set(API_KEY_HEADER, apiKey);
        }
        return headers;
    }

    private List<AnomalyRecord> parseAnomalies(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        DetectionResponse response = objectMapper.readValue(body, DetectionResponse.class);
        return response.getAnomalies() == null ? List.of() : response.getAnomalies();
    }

    private void logAnomalies(int batchSize, List<AnomalyRecord> anomalies) {
        if (anomalies.isEmpty()) {
            log.info("Batch of {} events processed; no anomalies", batchSize);
            return;
        }
        log.info("Batch of {} events processed; {} anomalies detected", batchSize, anomalies.size());
        anomalies.stream()
                .limit(MAX_LOGGED_EXPLANATIONS)
                .forEach(a -> log.info("  anomaly index={} ncd={} explanation={}",
                        a.getIndex(), a.metric("ncd"), abbreviate(a.getExplanation())));
    }

    private boolean retryAfter(Duration delay, int attempt) {
        stats.recordRetry();
        log.info("Retrying batch in {}s (attempt {}/{})", delay.toSeconds(), attempt + 1, retrySettings.getMaxAttempts());
        return pause(delay);
    }

    private boolean pause(Duration delay) {
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ForwardResult drop(List<CanonicalRecord> batch, Integer status, int attempts, String reason) {
        stats.recordDropped(batch.size());
        log.warn("Dropping batch of {} events after {} attempt(s): {}", batch.size(), attempts, reason);
        return ForwardResult.dropped(status, attempts);
    }

    private static long elapsedMicros(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000L;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
