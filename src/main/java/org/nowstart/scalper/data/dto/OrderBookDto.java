package org.nowstart.scalper.data.dto;

import java.util.List;
import java.util.Optional;

/**
 * Order book snapshot. Bids are sorted best (highest) first and asks best (lowest) first.
 */
public record OrderBookDto(
        String pair,
        List<PriceLevel> bids,
        List<PriceLevel> asks
) {

    public Optional<PriceLevel> bestBid() {
        return bids.isEmpty() ? Optional.empty() : Optional.of(bids.get(0));
    }

    public Optional<PriceLevel> bestAsk() {
        return asks.isEmpty() ? Optional.empty() : Optional.of(asks.get(0));
    }
}
