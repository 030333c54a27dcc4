package org.nowstart.scalper.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ValrMarketSummaryResponse(
        String currencyPair,
        String askPrice,
        String bidPrice,
        String lastTradedPrice,
        String high,
        String low,
        String baseVolume
) {
}
