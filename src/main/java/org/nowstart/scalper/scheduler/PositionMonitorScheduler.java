package org.nowstart.scalper.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.scalper.service.PositionMonitorService;
import org.nowstart.scalper.service.TradingLifecycleService;
import org.nowstart.scalper.service.TradingStateService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PositionMonitorScheduler {

    private final PositionMonitorService positionMonitorService;
    private final TradingStateService tradingStateService;
    private final TradingLifecycleService tradingLifecycleService;

    @Scheduled(fixedDelayString = "${scalper.trading.monitor-interval:15s}")
    public void monitor() {
        if (!tradingStateService.isReady()) {
            return;
        }
        positionMonitorService.monitorPositions();
    }

    @Scheduled(cron = "${scalper.trading.order-cleanup-cron:0 0 * * * *}", zone = "UTC")
    public void pruneStaleOrderRecords() {
        tradingLifecycleService.pruneStaleOrderRecords();
    }
}
