package org.nowstart.scalper.data.model;

import java.util.List;

public record PairSymbol(String base, String quote) {

    // 긴 접미사를 먼저 비교해야 USDT/USDC 가 USD 로 잘리지 않는다
    private static final List<String> QUOTE_CURRENCIES = List.of("USDT", "USDC", "ZAR", "USD", "EUR", "BTC", "ETH");

    public static PairSymbol parse(String pair) {
        String normalized = pair == null ? "" : pair.trim().toUpperCase();
        for (String quote : QUOTE_CURRENCIES) {
            if (normalized.length() > quote.length() && normalized.endsWith(quote)) {
                return new PairSymbol(normalized.substring(0, normalized.length() - quote.length()), quote);
            }
        }
        throw new IllegalArgumentException("Unsupported pair: " + pair);
    }
}
