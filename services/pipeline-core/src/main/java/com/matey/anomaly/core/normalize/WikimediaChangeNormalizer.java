package com.matey.anomaly.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.model.CanonicalRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Normalizes Wikimedia EventStreams {@code recentchange} events (the JSON carried in the
 * SSE {@code data:} field). The wiki ({@code enwiki}, {@code commonswiki}, ...) is the
 * record's symbol and the message reads {@code Edit by <user> on <title>: <comment>}.
 */
@Slf4j
@RequiredArgsConstructor
public class WikimediaChangeNormalizer implements RawMessageNormalizer {

    private final ObjectMapper objectMapper;

    @Override
    public Optional<CanonicalRecord> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode event = objectMapper.readTree(raw);
            if (event == null || !event.isObject()) {
                return Optional.empty();
            }
            return Optional.ofNullable(fromChange(event));
        } catch (Exception e) {
            log.debug("Skipping malformed recentchange event: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static CanonicalRecord fromChange(JsonNode event) {
        JsonNode meta = event.path("meta");
        String title = text(event, "title");
        String wiki = text(event, "wiki");
        if (title == null || wiki == null) {
            return null;
        }
        String user = Optional.ofNullable(text(event, "user")).orElse("unknown");
        String comment = text(event, "comment");

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(CanonicalRecord.TIMESTAMP, timestamp(meta, event));
        fields.put(CanonicalRecord.ID, Optional.ofNullable(text(meta, "id")).orElse(text(event, "id")));
        fields.put("type", text(event, "type"));
        fields.put(CanonicalRecord.SYMBOL, wiki);
        fields.put("user", user);
        fields.put("bot", event.path("bot").isBoolean() ? event.get("bot").booleanValue() : null);
        fields.put("title", title);
        fields.put("comment", comment);
        fields.put("server_url", text(event, "server_url"));
        fields.put("wiki", wiki);
        fields.put("length_new", length(event, "new"));
        fields.put("length_old", length(event, "old"));
        fields.put(CanonicalRecord.MESSAGE, comment == null
                ? "Edit by " + user + " on " + title
                : "Edit by " + user + " on " + title + ": " + comment);
        return CanonicalRecord.of(fields);
    }

    private static String timestamp(JsonNode meta, JsonNode event) {
        String dt = text(meta, "dt");
        if (dt != null) {
            return dt;
        }
        JsonNode seconds = event.get("timestamp");
        return seconds != null && seconds.isIntegralNumber()
                ? Instant.ofEpochSecond(seconds.longValue()).toString()
                : null;
    }

    private static Long length(JsonNode event, String which) {
        JsonNode value = event.path("length").get(which);
        return value != null && value.isIntegralNumber() ? value.longValue() : null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
