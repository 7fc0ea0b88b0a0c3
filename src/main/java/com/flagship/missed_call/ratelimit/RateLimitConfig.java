package com.flagship.missed_call.ratelimit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.Optional;

/**
 * Chooses the limiter: Redis-backed when a RedisTemplate exists, in-process
 * otherwise. The in-process one is always created as the Redis fallback.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RateLimitConfig {

    @Bean
    public InMemoryRateLimiter inMemoryRateLimiter() {
        return new InMemoryRateLimiter();
    }

    @Bean
    @Primary
    public RateLimiter rateLimiter(Optional<RedisTemplate<String, String>> redisTemplate,
                                   InMemoryRateLimiter inMemoryRateLimiter) {
        if (redisTemplate.isPresent()) {
            log.info("Rate limiting backed by Redis");
            return new RedisRateLimiter(redisTemplate.get(), inMemoryRateLimiter);
        }
        log.info("Redis not configured, rate limiting is per instance");
        return inMemoryRateLimiter;
    }

    @Bean
    public RateLimitEviction rateLimitEviction(InMemoryRateLimiter inMemoryRateLimiter) {
        return new RateLimitEviction(inMemoryRateLimiter);
    }

    @RequiredArgsConstructor
    public static class RateLimitEviction {

        private final InMemoryRateLimiter limiter;

        @Scheduled(fixedRateString = "${missed-call.rate-limit.eviction-interval-ms:60000}")
        public void evictExpired() {
            limiter.evictExpired();
        }
    }
}
