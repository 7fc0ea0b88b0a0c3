package com.flagship.missed_call.ratelimit;

import java.time.Duration;

/**
 * Fixed-window request counter. Every call counts against the window,
 * including calls that end up rejected.
 */
public interface RateLimiter {

    RateLimitDecision check(String key, int limit, Duration window);
}
