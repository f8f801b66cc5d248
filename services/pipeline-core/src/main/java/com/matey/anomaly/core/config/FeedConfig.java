package com.matey.anomaly.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.feed.BinanceSubscriptionProtocol;
import com.matey.anomaly.core.feed.FeedClient;
import com.matey.anomaly.core.feed.FeedConnector;
import com.matey.anomaly.core.feed.FeedSchema;
import com.matey.anomaly.core.feed.KrakenSubscriptionProtocol;
import com.matey.anomaly.core.feed.PollingFeedClient;
import com.matey.anomaly.core.feed.SseFeedClient;
import com.matey.anomaly.core.feed.WebSocketFeedTransport;
import com.matey.anomaly.core.normalize.BinanceTradeNormalizer;
import com.matey.anomaly.core.normalize.CoinGeckoPriceNormalizer;
import com.matey.anomaly.core.normalize.KrakenTradeNormalizer;
import com.matey.anomaly.core.normalize.RawMessageNormalizer;
import com.matey.anomaly.core.normalize.SyntheticSpikeNormalizer;
import com.matey.anomaly.core.normalize.WikimediaChangeNormalizer;
import com.matey.anomaly.core.retry.BackoffPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * Upstream feed wiring shared by the services that read a feed directly (the feed
 * bridge and the single-process detection pipeline). Imported explicitly by those
 * services.
 *
 * {@code app.feed.schema} picks the feed: binance or kraken over WebSocket, wikimedia
 * over Server-Sent Events, coingecko by polling. The URL and topics fall back to the
 * schema's defaults when blank; topics are a comma separated list of streams, pairs or
 * coin ids depending on the schema.
 */
@Slf4j
@Configuration
public class FeedConfig {

    static final Duration MIN_POLL_EVERY = Duration.ofMillis(2500);

    @Value("${app.feed.schema:binance}")
    private String schemaName;

    @Value("${app.feed.url:}")
    private String feedUrl;

    @Value("${app.feed.topics:}")
    private List<String> topics;

    @Value("${app.feed.connect-timeout-ms:10000}")
    private long connectTimeoutMs;

    @Value("${app.feed.idle-timeout-ms:60000}")
    private long idleTimeoutMs;

    @Value("${app.feed.poll-interval-ms:250}")
    private long pollIntervalMs;

    @Value("${app.feed.max-message-bytes:1048576}")
    private int maxMessageBytes;

    @Value("${app.feed.reconnect.initial-ms:1000}")
    private long reconnectInitialMs;

    @Value("${app.feed.reconnect.max-ms:60000}")
    private long reconnectMaxMs;

    @Value("${app.feed.user-agent:market-anomaly-pipeline/1.0}")
    private String userAgent;

    @Value("${app.feed.vs-currency:usd}")
    private String vsCurrency;

    @Value("${app.feed.poll-every-ms:5000}")
    private long pollEveryMs;

    @Value("${app.feed.api-key:}")
    private String apiKey;

    @Value("${app.feed.synthetic-every:0}")
    private long syntheticEvery;

    @Bean
    public FeedSchema feedSchema() {
        FeedSchema schema = FeedSchema.fromName(schemaName);
        log.info("Feed schema: {} url={} topics={}", schema, feedUri(schema), feedTopics(schema));
        return schema;
    }

    @Bean
    public FeedClient feedClient(FeedSchema feedSchema, ObjectMapper objectMapper, RestTemplateBuilder builder) {
        BackoffPolicy backoff =
                BackoffPolicy.exponential(Duration.ofMillis(reconnectInitialMs), Duration.ofMillis(reconnectMaxMs));
        URI uri = feedUri(feedSchema);
        return switch (feedSchema) {
            case BINANCE -> webSocketClient(uri, feedSchema, backoff, objectMapper, false);
            case KRAKEN -> webSocketClient(uri, feedSchema, backoff, objectMapper, true);
            case WIKIMEDIA -> new SseFeedClient(
                    httpClient(builder, Duration.ofMillis(idleTimeoutMs)), uri, userAgent, backoff, null);
            case COINGECKO -> new PollingFeedClient(
                    httpClient(builder, Duration.ofMillis(connectTimeoutMs)),
                    coinGeckoUri(uri, feedTopics(feedSchema)),
                    coinGeckoHeaders(),
                    pollEvery(),
                    backoff,
                    null);
        };
    }

    @Bean
    public RawMessageNormalizer rawMessageNormalizer(FeedSchema feedSchema, ObjectMapper objectMapper) {
        RawMessageNormalizer normalizer = switch (feedSchema) {
            case BINANCE -> new BinanceTradeNormalizer(objectMapper);
            case KRAKEN -> new KrakenTradeNormalizer(objectMapper);
            case WIKIMEDIA -> new WikimediaChangeNormalizer(objectMapper);
            case COINGECKO -> new CoinGeckoPriceNormalizer(objectMapper, feedTopics(feedSchema), vsCurrency);
        };
        if (syntheticEvery > 0) {
            log.info("Injecting a synthetic spike every {} trades", syntheticEvery);
            return new SyntheticSpikeNormalizer(normalizer, syntheticEvery);
        }
        return normalizer;
    }

    private FeedConnector webSocketClient(URI uri, FeedSchema schema, BackoffPolicy backoff,
                                          ObjectMapper objectMapper, boolean kraken) {
        return new FeedConnector(
                uri,
                feedTopics(schema),
                new WebSocketFeedTransport(Duration.ofMillis(connectTimeoutMs), maxMessageBytes),
                backoff,
                kraken ? new KrakenSubscriptionProtocol(objectMapper) : new BinanceSubscriptionProtocol(objectMapper),
                Duration.ofMillis(pollIntervalMs),
                Duration.ofMillis(idleTimeoutMs),
                null);
    }

    private RestTemplate httpClient(RestTemplateBuilder builder, Duration readTimeout) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(readTimeout)
                .build();
    }

    private URI coinGeckoUri(URI base, List<String> coinIds) {
        return UriComponentsBuilder.fromUri(base)
                .queryParam("ids", String.join(",", coinIds))
                .queryParam("vs_currencies", vsCurrency)
                .queryParam("include_24hr_vol", "true")
                .queryParam("include_24hr_change", "true")
                .queryParam("precision", "8")
                .build()
                .toUri();
    }

    private HttpHeaders coinGeckoHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, userAgent);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set("x-cg-pro-api-key", apiKey);
        }
        return headers;
    }

    private Duration pollEvery() {
        Duration every = Duration.ofMillis(pollEveryMs);
        if (every.compareTo(MIN_POLL_EVERY) < 0) {
            log.warn("Poll interval {}ms is below the {}ms rate limit floor; using the floor",
                    pollEveryMs, MIN_POLL_EVERY.toMillis());
            return MIN_POLL_EVERY;
        }
        return every;
    }

    private URI feedUri(FeedSchema schema) {
        return URI.create(feedUrl == null || feedUrl.isBlank() ? schema.defaultUrl() : feedUrl.trim());
    }

    private List<String> feedTopics(FeedSchema schema) {
        List<String> configured = topics == null
                ? List.of()
                : topics.stream().map(String::trim).filter(t -> !t.isEmpty()).toList();
        return configured.isEmpty() ? schema.defaultTopics() : configured;
    }
}
