package com.matey.anomaly.core.feed;

import java.util.List;
import java.util.Locale;

/**
 * Upstream feeds the bridge knows how to read, with the endpoint and subscription
 * defaults used when {@code app.feed.url} or {@code app.feed.topics} are not set.
 */
public enum FeedSchema {

    BINANCE("wss://stream.binance.us:9443/ws",
            List.of("btcusdt@trade", "ethusdt@trade", "solusdt@trade", "linkusdt@trade",
                    "avaxusdt@trade", "dogeusdt@trade", "ltcusdt@trade")),
    KRAKEN("wss://ws.kraken.com", List.of("XBT/USD")),
    WIKIMEDIA("https://stream.wikimedia.org/v2/stream/recentchange", List.of()),
    COINGECKO("https://api.coingecko.com/api/v3/simple/price",
            List.of("bitcoin", "ethereum", "solana", "chainlink", "avalanche-2", "dogecoin", "litecoin"));

    private final String defaultUrl;
    private final List<String> defaultTopics;

    FeedSchema(String defaultUrl, List<String> defaultTopics) {
        this.defaultUrl = defaultUrl;
        this.defaultTopics = defaultTopics;
    }

    public String defaultUrl() {
        return defaultUrl;
    }

    /**
     * Exchange streams or pairs for the WebSocket feeds, coin ids for CoinGecko.
     */
    public List<String> defaultTopics() {
        return defaultTopics;
    }

    public static FeedSchema fromName(String name) {
        if (name == null || name.isBlank()) {
            return BINANCE;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown feed schema '" + name
                    + "'; expected one of binance, kraken, wikimedia, coingecko", e);
        }
    }
}
