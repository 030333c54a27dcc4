package org.nowstart.scalper.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.property.ValrProperties;
import org.springframework.stereotype.Component;

/**
 * Sliding 60 second window shared by every authenticated VALR call.
 */
@Slf4j
@Component
public class ValrRateLimiter {

    static final Duration WINDOW = Duration.ofSeconds(60);

    private final int maxRequestsPerWindow;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Deque<Instant> issuedAt = new ArrayDeque<>();

    public ValrRateLimiter(ValrProperties valrProperties, Clock clock, Sleeper sleeper) {
        this.maxRequestsPerWindow = valrProperties.rateLimitPerMinute();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public synchronized void acquire() {
        Instant now = clock.instant();
        evictExpired(now);

        while (issuedAt.size() >= maxRequestsPerWindow) {
            Duration wait = Duration.between(now, issuedAt.peekFirst().plus(WINDOW));
            if (wait.isNegative() || wait.isZero()) {
                wait = Duration.ofMillis(1);
            }
            log.warn("event=valr_rate_limit_wait wait_ms={} in_window={}", wait.toMillis(), issuedAt.size());
            sleeper.sleep(wait);
            now = clock.instant();
            evictExpired(now);
        }

        issuedAt.addLast(now);
    }

    public synchronized int windowSize() {
        evictExpired(clock.instant());
        return issuedAt.size();
    }

    private void evictExpired(Instant now) {
        Instant threshold = now.minus(WINDOW);
        while (!issuedAt.isEmpty() && !issuedAt.peekFirst().isAfter(threshold)) {
            issuedAt.pollFirst();
        }
    }
}
