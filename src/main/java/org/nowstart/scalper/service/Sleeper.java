package org.nowstart.scalper.service;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);

    static Sleeper system() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return;
            }
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting", e);
            }
        };
    }
}
