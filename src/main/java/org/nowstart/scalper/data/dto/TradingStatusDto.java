package org.nowstart.scalper.data.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record TradingStatusDto(
        LocalDate date,
        int tradesToday,
        int maxDailyTrades,
        int winsToday,
        int lossesToday,
        int failedToday,
        BigDecimal dailyPnl,
        int openPositions,
        boolean dailyLimitReached,
        boolean ready,
        boolean shuttingDown
) {
}
