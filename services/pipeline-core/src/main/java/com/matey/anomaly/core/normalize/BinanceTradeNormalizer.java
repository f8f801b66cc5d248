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
 * Normalizes Binance {@code trade} and {@code aggTrade} stream events.
 *
 * Example input:
 * <pre>
 * {"e":"trade","E":1700000000001,"s":"BTCUSDT","t":12345,"p":"37000.10","q":"0.002","T":1700000000000,"m":true}
 * </pre>
 * Events wrapped by a combined stream ({@code {"stream":..., "data":{...}}}) are unwrapped.
 */
@Slf4j
@RequiredArgsConstructor
public class BinanceTradeNormalizer implements RawMessageNormalizer {

    public static final String RECORD_TYPE = "crypto_trade";

    private final ObjectMapper objectMapper;

    @Override
    public Optional<CanonicalRecord> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node != null && node.has("stream") && node.path("data").isObject()) {
                node = node.get("data");
            }
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.ofNullable(fromTradeEvent(node));
        } catch (Exception e) {
            log.debug("Skipping malformed feed message: {} ({})", abbreviate(raw), e.getMessage());
            return Optional.empty();
        }
    }

    private CanonicalRecord fromTradeEvent(JsonNode node) {
        String eventType = node.path("e").asText(null);
        String idField;
        if ("trade".equals(eventType)) {
            idField = "t";
        } else if ("aggTrade".equals(eventType)) {
            idField = "a";
        } else {
            return null;
        }

        String symbol = node.path("s").asText("");
        JsonNode tradeId = node.get(idField);
        JsonNode tradeTime = node.hasNonNull("T") ? node.get("T") : node.get("E");
        JsonNode buyerIsMaker = node.get("m");
        if (symbol.isBlank()
                || tradeId == null || !tradeId.isValueNode() || tradeId.isNull()
                || tradeTime == null || !tradeTime.isIntegralNumber()
                || buyerIsMaker == null || !buyerIsMaker.isBoolean()) {
            return null;
        }

        double price = numeric(node, "p");
        double quantity = numeric(node, "q");
        String side = buyerIsMaker.booleanValue() ? "SELL" : "BUY";

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(CanonicalRecord.TIMESTAMP, Instant.ofEpochMilli(tradeTime.longValue()).toString());
        fields.put(CanonicalRecord.ID, tradeId.asText());
        fields.put("type", RECORD_TYPE);
        fields.put(CanonicalRecord.SYMBOL, symbol);
        fields.put("price", price);
        fields.put("quantity", quantity);
        fields.put("volume_usd", price * quantity);
        fields.put("side", side);
        fields.put(CanonicalRecord.MESSAGE, TradeMessages.describe(side, quantity, symbol, price));
        return CanonicalRecord.of(fields);
    }

    private static double numeric(JsonNode node, String field) {
        return Numbers.coerce(node.get(field), field);
    }

    private static String abbreviate(String raw) {
        return raw.length() <= 120 ? raw : raw.substring(0, 120) + "...";
    }
}
