package com.flagship.missed_call.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Readiness checks specific to the pipeline.
 */
public class HealthIndicators {

    /**
     * Billing alerts pile up in the outbox when Kafka is unreachable. Reads
     * the gauges {@link OutboxMetrics} keeps, not the table.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long MAX_PENDING = 1000;
        static final Duration MAX_PENDING_AGE = Duration.ofMinutes(15);

        private final OutboxMetrics outboxMetrics;

        public OutboxHealthIndicator(OutboxMetrics outboxMetrics) {
            this.outboxMetrics = outboxMetrics;
        }

        @Override
        public Health health() {
            long pending = outboxMetrics.pending();
            long oldestSeconds = outboxMetrics.oldestPendingSeconds();
            long exhausted = outboxMetrics.exhausted();

            Health.Builder builder;
            if (oldestSeconds > MAX_PENDING_AGE.toSeconds()) {
                builder = Health.down();
            } else if (pending > MAX_PENDING || exhausted > 0) {
                builder = Health.status("WARNING");
            } else {
                builder = Health.up();
            }
            return builder
                    .withDetail("pending", pending)
                    .withDetail("oldestPendingSeconds", oldestSeconds)
                    .withDetail("exhausted", exhausted)
                    .build();
        }
    }

    /**
     * Redis backs the idempotency fast path and rate-limit counters. Both fall
     * back to the database or process memory, so Redis trouble is DEGRADED,
     * never DOWN.
     */
    @Component("pipelineRedisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency uses the database and rate limits are per instance";

        private final Optional<RedisTemplate<String, String>> redisTemplate;

        public RedisHealthIndicator(Optional<RedisTemplate<String, String>> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            if (redisTemplate.isEmpty()) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis not configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try {
                String pong = redisTemplate.get().execute((RedisCallback<String>) connection -> connection.ping());
                if ("PONG".equals(pong)) {
                    return Health.up().withDetail("response", pong).build();
                }
                return Health.status("DEGRADED")
                        .withDetail("response", pong != null ? pong : "null")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }
}
