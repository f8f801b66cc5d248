package com.matey.anomaly.core.normalize;

import java.util.Locale;

final class TradeMessages {

    private TradeMessages() {
    }

    /**
     * e.g. {@code SELL 0.1234 BTCUSD @ 43250.00000000}
     */
    static String describe(String side, double quantity, String symbol, double price) {
        return String.format(Locale.ROOT, "%s %.4f %s @ %.8f", side, quantity, symbol, price);
    }
}
