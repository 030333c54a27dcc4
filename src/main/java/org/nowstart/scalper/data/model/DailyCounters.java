package org.nowstart.scalper.data.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Getter;

@Getter
public class DailyCounters {

    private LocalDate date;
    private int tradesToday;
    private int winsToday;
    private int lossesToday;
    private int failedToday;
    private BigDecimal dailyPnl = BigDecimal.ZERO;

    public DailyCounters(LocalDate date) {
        this.date = date;
    }

    /**
     * Resets every counter when {@code today} differs from the tracked UTC day.
     */
    public boolean rollOver(LocalDate today) {
        if (today.equals(date)) {
            return false;
        }
        date = today;
        tradesToday = 0;
        winsToday = 0;
        lossesToday = 0;
        failedToday = 0;
        dailyPnl = BigDecimal.ZERO;
        return true;
    }

    public void recordTrade() {
        tradesToday++;
    }

    public void recordFailedTrade() {
        tradesToday++;
        failedToday++;
    }

    public void recordExit(BigDecimal pnl) {
        if (pnl.signum() > 0) {
            winsToday++;
        } else {
            lossesToday++;
        }
        dailyPnl = dailyPnl.add(pnl);
    }
}
