package com.zzf.cryptoagent.core.ratelimit;

import com.zzf.cryptoagent.config.CryptoAgentConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window admission gate shared by every exchange-bound tool.
 * <p>
 * A denial is immediate: callers get {@code false} and decide what to report. Nothing here
 * sleeps or retries.
 */
@Component
public class RateLimiter {
    private final int maxCalls;
    private final long windowMillis;
    private final Clock clock;
    private final Deque<Long> calls = new ArrayDeque<>();

    @Autowired
    public RateLimiter(CryptoAgentConfig config, Clock clock) {
        this(config.getRateLimit().getMaxCalls(), Duration.ofSeconds(config.getRateLimit().getWindowSeconds()), clock);
    }

    public RateLimiter(int maxCalls, Duration window, Clock clock) {
        if (maxCalls <= 0) {
            throw new IllegalArgumentException("maxCalls must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxCalls = maxCalls;
        this.windowMillis = window.toMillis();
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public synchronized boolean admit() {
        long now = clock.millis();
        while (!calls.isEmpty() && now - calls.peekFirst() >= windowMillis) {
            calls.pollFirst();
        }
        if (calls.size() < maxCalls) {
            calls.addLast(now);
            return true;
        }
        return false;
    }

    public synchronized int windowCount() {
        return calls.size();
    }
}
