package com.matey.anomaly.core.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.matey.anomaly.core.io.AppendOnlyLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts batches of confirmed anomalies to the notification endpoint as
 * {@code {"query": ..., "anomalies": [...]}} and logs the response verbatim.
 *
 * Every attempt, successful or not, is also appended as one JSON line to the
 * notification journal when one is configured.
 */
@Slf4j
public class NotificationClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String url;
    private final String query;
    private final AppendOnlyLog journal;
    private final Clock clock;

    public NotificationClient(RestTemplate restTemplate, ObjectMapper objectMapper,
                              String url, String query, AppendOnlyLog journal) {
        this(restTemplate, objectMapper, url, query, journal, Clock.systemUTC());
    }

    public NotificationClient(RestTemplate restTemplate, ObjectMapper objectMapper,
                              String url, String query, AppendOnlyLog journal, Clock clock) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.url = url;
        this.query = query;
        this.journal = journal;
        this.clock = clock;
    }

    /**
     * One attempt, no retry.
     *
     * @return true if the endpoint answered with a 2xx status
     */
    public boolean send(List<JsonNode> anomalies) {
        if (anomalies.isEmpty()) {
            return true;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("anomalies", anomalies);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        log.info("Sending {} anomalies to {}", anomalies.size(), url);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
            log.info("Notification response. status={} body={}", response.getStatusCode().value(), response.getBody());
            journalSuccess(anomalies.size(), response.getBody());
            return true;
        } catch (RestClientException e) {
            log.error("Notification failed for {} anomalies: {}", anomalies.size(), e.getMessage());
            journalFailure(e.getMessage());
            return false;
        }
    }

    private void journalSuccess(int batchSize, String body) {
        ObjectNode entry = objectMapper.createObjectNode();
        entry.put("timestamp", Instant.now(clock).toString());
        entry.put("batch_size", batchSize);
        entry.set("response", parseOrText(body));
        journal(entry);
    }

    private void journalFailure(String error) {
        ObjectNode entry = objectMapper.createObjectNode();
        entry.put("timestamp", Instant.now(clock).toString());
        entry.put("error", error);
        journal(entry);
    }

    private JsonNode parseOrText(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.nullNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return objectMapper.getNodeFactory().textNode(body);
        }
    }

    private void journal(ObjectNode entry) {
        if (journal == null) {
            return;
        }
        try {
            journal.append(objectMapper.writeValueAsString(entry));
        } catch (IOException e) {
            log.warn("Failed to write notification journal {}: {}", journal.getPath(), e.getMessage());
        }
    }
}
