package com.matey.anomaly.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.model.CanonicalRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Normalizes a CoinGecko {@code /simple/price} response into one {@code crypto_price}
 * record per tracked coin, stamped with the time of the poll:
 * <pre>
 * {"bitcoin":{"usd":43250.1,"usd_24h_vol":1.2E10,"usd_24h_change":-1.52}, ...}
 * </pre>
 * Coins absent from the response are skipped; missing figures default to 0.
 */
@Slf4j
public class CoinGeckoPriceNormalizer implements RawMessageNormalizer {

    public static final String RECORD_TYPE = "crypto_price";

    private final ObjectMapper objectMapper;
    private final List<String> coinIds;
    private final String vsCurrency;
    private final Clock clock;

    public CoinGeckoPriceNormalizer(ObjectMapper objectMapper, List<String> coinIds, String vsCurrency) {
        this(objectMapper, coinIds, vsCurrency, Clock.systemUTC());
    }

    public CoinGeckoPriceNormalizer(ObjectMapper objectMapper, List<String> coinIds, String vsCurrency, Clock clock) {
        this.objectMapper = objectMapper;
        this.coinIds = List.copyOf(coinIds);
        this.vsCurrency = vsCurrency.toLowerCase(Locale.ROOT);
        this.clock = clock;
    }

    /**
     * First tracked coin only; the streaming path uses {@link #normalizeAll(String)}.
     */
    @Override
    public Optional<CanonicalRecord> normalize(String raw) {
        return normalizeAll(raw).stream().findFirst();
    }

    @Override
    public List<CanonicalRecord> normalizeAll(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        JsonNode payload;
        try {
            payload = objectMapper.readTree(raw);
        } catch (Exception e) {
            log.debug("Skipping malformed CoinGecko response: {}", e.getMessage());
            return List.of();
        }
        if (payload == null || !payload.isObject()) {
            return List.of();
        }

        Instant now = clock.instant();
        List<CanonicalRecord> records = new ArrayList<>();
        for (String coinId : coinIds) {
            JsonNode data = payload.get(coinId);
            if (data == null || !data.isObject()) {
                continue;
            }
            try {
                records.add(fromPrice(coinId, data, now));
            } catch (RuntimeException e) {
                log.debug("Skipping malformed price for {}: {}", coinId, e.getMessage());
            }
        }
        return records;
    }

    private CanonicalRecord fromPrice(String coinId, JsonNode data, Instant now) {
        double price = Numbers.coerce(data.get(vsCurrency), vsCurrency);
        double volume = Numbers.coerce(data.get(vsCurrency + "_24h_vol"), "24h volume");
        double change = Numbers.coerce(data.get(vsCurrency + "_24h_change"), "24h change");
        String symbol = coinId.replace("-", "").toUpperCase(Locale.ROOT);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(CanonicalRecord.TIMESTAMP, now.toString());
        fields.put(CanonicalRecord.ID, coinId + "-" + now.getEpochSecond());
        fields.put("type", RECORD_TYPE);
        fields.put(CanonicalRecord.SYMBOL, symbol);
        fields.put("price", price);
        fields.put("volume_usd", volume);
        fields.put("change_24h", change);
        fields.put(CanonicalRecord.MESSAGE,
                String.format(Locale.ROOT, "%s price $%.4f (24h %+.2f%%)", symbol, price, change));
        return CanonicalRecord.of(fields);
    }
}
