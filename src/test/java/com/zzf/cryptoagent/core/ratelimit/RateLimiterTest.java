package com.zzf.cryptoagent.core.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimiterTest {

    @Test
    void shouldDenyOnceWindowIsFull() {
        ManualClock clock = new ManualClock();
        RateLimiter limiter = new RateLimiter(3, Duration.ofSeconds(60), clock);

        assertTrue(limiter.admit());
        assertTrue(limiter.admit());
        assertTrue(limiter.admit());
        assertFalse(limiter.admit());
        assertFalse(limiter.admit());
        assertEquals(3, limiter.windowCount());
    }

    @Test
    void shouldResumeAfterWindowElapses() {
        ManualClock clock = new ManualClock();
        RateLimiter limiter = new RateLimiter(2, Duration.ofSeconds(60), clock);
        assertTrue(limiter.admit());
        assertTrue(limiter.admit());
        assertFalse(limiter.admit());

        clock.advance(Duration.ofSeconds(59));
        assertFalse(limiter.admit());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(limiter.admit());
        assertTrue(limiter.admit());
        assertFalse(limiter.admit());
    }

    @Test
    void shouldOnlyPruneExpiredEntries() {
        ManualClock clock = new ManualClock();
        RateLimiter limiter = new RateLimiter(2, Duration.ofSeconds(10), clock);
        assertTrue(limiter.admit());
        clock.advance(Duration.ofSeconds(6));
        assertTrue(limiter.admit());
        clock.advance(Duration.ofSeconds(5));

        // first admission expired, second still counts
        assertTrue(limiter.admit());
        assertFalse(limiter.admit());
    }

    @Test
    void deniedCallsDoNotConsumeCapacity() {
        ManualClock clock = new ManualClock();
        RateLimiter limiter = new RateLimiter(1, Duration.ofSeconds(10), clock);
        assertTrue(limiter.admit());
        for (int i = 0; i < 5; i++) {
            assertFalse(limiter.admit());
        }
        clock.advance(Duration.ofSeconds(10));
        assertTrue(limiter.admit());
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, Duration.ofSeconds(60), Clock.systemUTC()));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(10, Duration.ZERO, Clock.systemUTC()));
    }

    static final class ManualClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
