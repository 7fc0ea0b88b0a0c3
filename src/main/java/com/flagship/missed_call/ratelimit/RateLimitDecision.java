package com.flagship.missed_call.ratelimit;

import lombok.Value;

import java.time.Duration;

@Value
public class RateLimitDecision {
    boolean allowed;
    long remaining;
    /** Time until the current window resets. */
    Duration retryAfter;

    public static RateLimitDecision allow(long remaining, Duration retryAfter) {
        return new RateLimitDecision(true, remaining, retryAfter);
    }

    public static RateLimitDecision reject(Duration retryAfter) {
        return new RateLimitDecision(false, 0, retryAfter);
    }
}
