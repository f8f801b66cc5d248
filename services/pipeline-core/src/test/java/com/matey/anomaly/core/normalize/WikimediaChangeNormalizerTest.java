package com.matey.anomaly.core.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.model.CanonicalRecord;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WikimediaChangeNormalizerTest {

    private final WikimediaChangeNormalizer normalizer = new WikimediaChangeNormalizer(new ObjectMapper());

    @Test
    void normalizesRecentChange() {
        String raw = "{\"$schema\":\"/mediawiki/recentchange/1.0.0\","
                + "\"meta\":{\"id\":\"7b1c9e2a\",\"dt\":\"2024-05-01T10:00:00Z\",\"stream\":\"mediawiki.recentchange\"},"
                + "\"id\":99,\"type\":\"edit\",\"title\":\"Java (programming language)\",\"comment\":\"fix typo\","
                + "\"timestamp\":1714557600,\"user\":\"Alice\",\"bot\":false,"
                + "\"server_url\":\"https://en.wikipedia.org\",\"wiki\":\"enwiki\",\"length\":{\"old\":100,\"new\":120}}";

        CanonicalRecord record = normalizer.normalize(raw).orElseThrow();

        assertThat(record.getId()).isEqualTo("7b1c9e2a");
        assertThat(record.get("timestamp")).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(record.get("type")).isEqualTo("edit");
        assertThat(record.getSymbol()).isEqualTo("enwiki");
        assertThat(record.get("user")).isEqualTo("Alice");
        assertThat(record.get("bot")).isEqualTo(false);
        assertThat(record.get("server_url")).isEqualTo("https://en.wikipedia.org");
        assertThat(record.get("length_new")).isEqualTo(120L);
        assertThat(record.get("length_old")).isEqualTo(100L);
        assertThat(record.getMessage()).isEqualTo("Edit by Alice on Java (programming language): fix typo");
    }

    @Test
    void fallsBackToEventIdAndEpochTimestamp() {
        String raw = "{\"id\":12345,\"type\":\"new\",\"title\":\"Sandbox\",\"comment\":\"  \","
                + "\"timestamp\":1714557600,\"wiki\":\"commonswiki\"}";

        CanonicalRecord record = normalizer.normalize(raw).orElseThrow();

        assertThat(record.getId()).isEqualTo("12345");
        assertThat(record.get("timestamp")).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(record.get("user")).isEqualTo("unknown");
        assertThat(record.get("comment")).isNull();
        assertThat(record.get("length_new")).isNull();
        assertThat(record.getMessage()).isEqualTo("Edit by unknown on Sandbox");
    }

    @Test
    void eventsWithoutTitleOrWikiAreSkipped() {
        assertThat(normalizer.normalize("{\"id\":1,\"timestamp\":1714557600,\"wiki\":\"enwiki\"}")).isEmpty();
        assertThat(normalizer.normalize("{\"id\":1,\"timestamp\":1714557600,\"title\":\"Sandbox\"}")).isEmpty();
    }

    @Test
    void eventWithoutAnyTimestampIsSkipped() {
        assertThat(normalizer.normalize("{\"id\":1,\"title\":\"Sandbox\",\"wiki\":\"enwiki\"}")).isEmpty();
    }

    @Test
    void malformedPayloadIsSkipped() {
        assertThat(normalizer.normalize("{\"title\":")).isEmpty();
        assertThat(normalizer.normalize("[]")).isEmpty();
        assertThat(normalizer.normalizeAll(" ")).isEmpty();
    }
}
