package com.matey.anomaly.core.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.model.CanonicalRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class KrakenTradeNormalizerTest {

    private static final String TRADES = "[0,["
            + "[\"37000.10000\",\"0.50000000\",\"1700000000.123456\",\"b\",\"m\",\"\"],"
            + "[\"37001.00000\",\"0.25000000\",\"1700000001.500000\",\"s\",\"l\",\"\"]"
            + "],\"trade\",\"XBT/USD\"]";

    private final KrakenTradeNormalizer normalizer = new KrakenTradeNormalizer(new ObjectMapper());

    @Test
    void normalizesEveryTradeInMessage() {
        List<CanonicalRecord> records = normalizer.normalizeAll(TRADES);

        assertThat(records).hasSize(2);
        CanonicalRecord buy = records.get(0);
        assertThat(buy.getId()).isEqualTo("kraken-1700000000123-0");
        assertThat(buy.get("timestamp")).isEqualTo("2023-11-14T22:13:20.123Z");
        assertThat(buy.get("type")).isEqualTo("crypto_trade");
        assertThat(buy.getSymbol()).isEqualTo("XBTUSD");
        assertThat(buy.get("pair")).isEqualTo("XBT/USD");
        assertThat(buy.get("price")).isEqualTo(37000.1);
        assertThat(buy.get("quantity")).isEqualTo(0.5);
        assertThat((Double) buy.get("volume_usd")).isCloseTo(18500.05, within(1e-6));
        assertThat(buy.get("side")).isEqualTo("BUY");
        assertThat(buy.get("order_type")).isEqualTo("m");
        assertThat(buy.get("source")).isEqualTo("kraken");
        assertThat(buy.getMessage()).isEqualTo("BUY 0.5000 XBTUSD @ 37000.10000000");

        CanonicalRecord sell = records.get(1);
        assertThat(sell.getId()).isEqualTo("kraken-1700000001500-1");
        assertThat(sell.get("side")).isEqualTo("SELL");
        assertThat(sell.get("order_type")).isEqualTo("l");
    }

    @Test
    void singleRecordContractReturnsFirstTrade() {
        assertThat(normalizer.normalize(TRADES))
                .map(CanonicalRecord::getId)
                .contains("kraken-1700000000123-0");
    }

    @Test
    void badTradeIsSkippedWithoutDroppingTheRest() {
        String raw = "[42,["
                + "[\"not-a-price\",\"1\",\"1700000000.0\",\"b\",\"m\",\"\"],"
                + "[\"100\",\"2\",\"1700000000.0\",\"x\",\"m\",\"\"],"
                + "[\"100\",\"2\",\"1700000000.0\",\"s\",\"m\",\"\"]"
                + "],\"trade\",\"ETH/USD\"]";

        List<CanonicalRecord> records = normalizer.normalizeAll(raw);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getId()).isEqualTo("kraken-1700000000000-2");
        assertThat(records.get(0).getSymbol()).isEqualTo("ETHUSD");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"event\":\"heartbeat\"}",
            "{\"event\":\"subscriptionStatus\",\"status\":\"subscribed\",\"pair\":\"XBT/USD\"}",
            "[0,[[\"1\",\"1\",\"1700000000.0\",\"b\",\"m\",\"\"]],\"book-10\",\"XBT/USD\"]",
            "[0,[[\"1\",\"1\",\"1700000000.0\",\"b\",\"m\",\"\"]],\"trade\",\"\"]",
            "[0,\"trade\",\"XBT/USD\"]",
            "[0,[",
            ""
    })
    void ignoresNonTradeMessages(String raw) {
        assertThat(normalizer.normalizeAll(raw)).isEmpty();
        assertThat(normalizer.normalize(raw)).isEmpty();
    }
}
