package com.flagship.missed_call.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Shared limiter on Redis counters: INCR, and EXPIRE on the first hit of a
 * window. If Redis fails the check is answered by the in-process limiter, so
 * an outage loosens limits to per-instance instead of blocking logins.
 */
@Slf4j
public class RedisRateLimiter implements RateLimiter {

    static final String KEY_PREFIX = "rate_limit:";

    private final RedisTemplate<String, String> redisTemplate;
    private final RateLimiter fallback;

    public RedisRateLimiter(RedisTemplate<String, String> redisTemplate, RateLimiter fallback) {
        this.redisTemplate = redisTemplate;
        this.fallback = fallback;
    }

    @Override
    public RateLimitDecision check(String key, int limit, Duration window) {
        String redisKey = KEY_PREFIX + key;
        try {
            Long count = redisTemplate.opsForValue().increment(redisKey);
            if (count == null) {
                throw new IllegalStateException("INCR returned no value for " + redisKey);
            }
            if (count == 1) {
                redisTemplate.expire(redisKey, window);
            }
            Long ttl = redisTemplate.getExpire(redisKey, TimeUnit.MILLISECONDS);
            if (ttl != null && ttl == -1) {
                // key left without a TTL by an interrupted first hit
                redisTemplate.expire(redisKey, window);
                ttl = window.toMillis();
            }
            Duration retryAfter = ttl != null && ttl > 0 ? Duration.ofMillis(ttl) : window;

            if (count > limit) {
                return RateLimitDecision.reject(retryAfter);
            }
            return RateLimitDecision.allow(limit - count, retryAfter);
        } catch (RuntimeException e) {
            log.warn("Redis rate limit check failed for {}, using in-process limiter: {}", key, e.getMessage());
            return fallback.check(key, limit, window);
        }
    }
}
