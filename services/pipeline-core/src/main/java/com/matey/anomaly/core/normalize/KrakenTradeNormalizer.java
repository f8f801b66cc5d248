package com.matey.anomaly.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.model.CanonicalRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Normalizes Kraken {@code trade} channel messages. One message carries every trade
 * since the previous one:
 * <pre>
 * [0,[["37000.10000","0.50000000","1700000000.123456","b","m",""]],"trade","XBT/USD"]
 * </pre>
 * Each trade is {@code [price, volume, time, side, orderType, misc]}; time is epoch
 * seconds with a fraction. A bad trade is skipped without dropping the rest.
 */
@Slf4j
@RequiredArgsConstructor
public class KrakenTradeNormalizer implements RawMessageNormalizer {

    private final ObjectMapper objectMapper;

    /**
     * First trade of the message only; the streaming path uses {@link #normalizeAll(String)}.
     */
    @Override
    public Optional<CanonicalRecord> normalize(String raw) {
        return normalizeAll(raw).stream().findFirst();
    }

    @Override
    public List<CanonicalRecord> normalizeAll(String raw) {
        if (raw == null || !raw.stripLeading().startsWith("[")) {
            return List.of();
        }
        JsonNode message;
        try {
            message = objectMapper.readTree(raw);
        } catch (Exception e) {
            log.debug("Skipping malformed Kraken message: {}", e.getMessage());
            return List.of();
        }
        int size = message.size();
        if (size < 4 || !"trade".equals(message.get(size - 2).asText()) || !message.get(1).isArray()) {
            return List.of();
        }
        String pair = message.get(size - 1).asText("");
        if (pair.isBlank()) {
            return List.of();
        }

        List<CanonicalRecord> records = new ArrayList<>();
        JsonNode trades = message.get(1);
        for (int i = 0; i < trades.size(); i++) {
            try {
                records.add(fromTrade(trades.get(i), i, pair));
            } catch (RuntimeException e) {
                log.debug("Skipping malformed Kraken trade {} of {}: {}", i, pair, e.getMessage());
            }
        }
        return records;
    }

    private static CanonicalRecord fromTrade(JsonNode trade, int index, String pair) {
        if (!trade.isArray() || trade.size() < 4) {
            throw new IllegalArgumentException("trade is not [price, volume, time, side, ...]");
        }
        double price = Numbers.coerce(trade.get(0), "price");
        double quantity = Numbers.coerce(trade.get(1), "volume");
        JsonNode time = trade.get(2);
        if (time == null || time.isNull()) {
            throw new IllegalArgumentException("missing trade time");
        }
        long epochMillis = Math.round(Numbers.coerce(time, "time") * 1000);
        String side = switch (trade.get(3).asText()) {
            case "b" -> "BUY";
            case "s" -> "SELL";
            default -> throw new IllegalArgumentException("unknown side " + trade.get(3));
        };
        String symbol = pair.replace("/", "");

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(CanonicalRecord.TIMESTAMP, Instant.ofEpochMilli(epochMillis).toString());
        fields.put(CanonicalRecord.ID, "kraken-" + epochMillis + "-" + index);
        fields.put("type", BinanceTradeNormalizer.RECORD_TYPE);
        fields.put(CanonicalRecord.SYMBOL, symbol);
        fields.put("pair", pair);
        fields.put("price", price);
        fields.put("quantity", quantity);
        fields.put("volume_usd", price * quantity);
        fields.put("side", side);
        fields.put("order_type", trade.size() > 4 ? trade.get(4).asText(null) : null);
        fields.put("source", "kraken");
        fields.put(CanonicalRecord.MESSAGE, TradeMessages.describe(side, quantity, symbol, price));
        return CanonicalRecord.of(fields);
    }
}
