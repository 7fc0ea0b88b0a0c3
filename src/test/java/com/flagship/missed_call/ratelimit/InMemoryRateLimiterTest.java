package com.flagship.missed_call.ratelimit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRateLimiterTest {

    private static final Duration WINDOW = Duration.ofMinutes(15);

    /** Clock the test can move forward. */
    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
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

    private final MutableClock clock = new MutableClock();
    private final InMemoryRateLimiter limiter = new InMemoryRateLimiter(clock);

    @Test
    @DisplayName("First N requests pass, the N+1th is rejected")
    void testLimitEnforced() {
        for (int i = 1; i <= 5; i++) {
            RateLimitDecision decision = limiter.check("k", 5, WINDOW);
            assertTrue(decision.isAllowed(), "request " + i);
            assertEquals(5 - i, decision.getRemaining());
        }

        RateLimitDecision sixth = limiter.check("k", 5, WINDOW);
        assertFalse(sixth.isAllowed());
        assertEquals(0, sixth.getRemaining());
        assertEquals(WINDOW, sixth.getRetryAfter());
    }

    @Test
    @DisplayName("Window resets after its duration")
    void testWindowResets() {
        for (int i = 0; i < 6; i++) {
            limiter.check("k", 5, WINDOW);
        }
        clock.advance(Duration.ofMinutes(10));
        RateLimitDecision stillBlocked = limiter.check("k", 5, WINDOW);
        assertFalse(stillBlocked.isAllowed());
        assertEquals(Duration.ofMinutes(5), stillBlocked.getRetryAfter());

        clock.advance(Duration.ofMinutes(5));
        assertTrue(limiter.check("k", 5, WINDOW).isAllowed());
    }

    @Test
    @DisplayName("Keys are counted independently")
    void testIndependentKeys() {
        for (int i = 0; i < 5; i++) {
            limiter.check("a", 5, WINDOW);
        }

        assertFalse(limiter.check("a", 5, WINDOW).isAllowed());
        assertTrue(limiter.check("b", 5, WINDOW).isAllowed());
    }

    @Test
    @DisplayName("Expired windows are evicted, live ones kept")
    void testEviction() {
        limiter.check("old", 5, Duration.ofMinutes(1));
        limiter.check("live", 5, WINDOW);
        assertEquals(2, limiter.size());

        clock.advance(Duration.ofMinutes(2));

        assertEquals(1, limiter.evictExpired());
        assertEquals(1, limiter.size());
    }

    @Test
    @DisplayName("Keys are lowercased, trimmed and bounded in length")
    void testKeys() {
        assertEquals("magic-link:email:owner@example.com",
                RateLimitKeys.key(RateLimitKeys.MAGIC_LINK, RateLimitKeys.EMAIL, "  Owner@Example.COM "));
        assertEquals("admin-login:ip:", RateLimitKeys.key(RateLimitKeys.ADMIN_LOGIN, RateLimitKeys.IP, null));

        String key = RateLimitKeys.key(RateLimitKeys.MAGIC_LINK, RateLimitKeys.EMAIL, "a".repeat(500));
        assertEquals("magic-link:email:".length() + RateLimitKeys.MAX_VALUE_LENGTH, key.length());
    }
}
