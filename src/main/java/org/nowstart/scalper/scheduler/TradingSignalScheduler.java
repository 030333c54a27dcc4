package org.nowstart.scalper.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.scalper.service.TradingSignalWorkflowService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TradingSignalScheduler {

    private final TradingSignalWorkflowService tradingSignalWorkflowService;

    @Scheduled(fixedDelayString = "${scalper.trading.scan-interval:60s}")
    public void run() {
        tradingSignalWorkflowService.runOnce();
    }
}
