package com.flagship.missed_call.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-process fixed-window limiter. Used when Redis is not configured and as
 * the fallback when Redis fails. Counts are per instance and lost on restart.
 */
@Slf4j
public class InMemoryRateLimiter implements RateLimiter {

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateLimiter() {
        this(Clock.systemUTC());
    }

    InMemoryRateLimiter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public RateLimitDecision check(String key, int limit, Duration window) {
        Instant now = clock.instant();
        Window current = windows.compute(key, (k, existing) ->
                existing == null || !now.isBefore(existing.resetAt)
                        ? new Window(now.plus(window), 1)
                        : new Window(existing.resetAt, existing.count + 1));

        Duration retryAfter = Duration.between(now, current.resetAt);
        if (current.count > limit) {
            return RateLimitDecision.reject(retryAfter);
        }
        return RateLimitDecision.allow(limit - current.count, retryAfter);
    }

    /**
     * Drops windows that have already reset.
     *
     * @return number of windows removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = windows.size();
        windows.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().resetAt));
        int evicted = before - windows.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired rate limit windows", evicted);
        }
        return evicted;
    }

    int size() {
        return windows.size();
    }

    private static final class Window {
        private final Instant resetAt;
        private final long count;

        private Window(Instant resetAt, long count) {
            this.resetAt = resetAt;
            this.count = count;
        }
    }
}
