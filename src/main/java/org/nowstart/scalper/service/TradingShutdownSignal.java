package org.nowstart.scalper.service;

import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Component;

@Component
public class TradingShutdownSignal {

    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);

    public boolean requestShutdown() {
        return shutdownRequested.compareAndSet(false, true);
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }
}
