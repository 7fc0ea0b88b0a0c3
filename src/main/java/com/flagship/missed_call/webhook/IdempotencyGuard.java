package com.flagship.missed_call.webhook;

import com.flagship.missed_call.callrecord.CallRecord;
import com.flagship.missed_call.callrecord.CallRecordService;
import com.flagship.missed_call.observability.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Recognizes webhook redeliveries by external event id.
 *
 * Redis is a cache in front of call_records.external_event_id, which stays
 * the source of truth. A Redis failure falls through to the database; a
 * database failure propagates, since guessing "not processed" risks a double
 * send.
 */
@Component
@Slf4j
public class IdempotencyGuard {

    static final String REDIS_KEY_PREFIX = "webhook-event:";
    static final Duration REDIS_TTL = Duration.ofDays(7);

    private final CallRecordService callRecordService;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final PipelineMetrics metrics;

    public IdempotencyGuard(CallRecordService callRecordService,
                            Optional<RedisTemplate<String, String>> redisTemplate,
                            PipelineMetrics metrics) {
        this.callRecordService = callRecordService;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    /**
     * @return the id of the call record already produced for this event, if any
     */
    public Optional<UUID> findProcessed(String externalEventId) {
        if (externalEventId == null || externalEventId.isBlank()) {
            throw new IllegalArgumentException("External event id cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + externalEventId);
                if (cached != null) {
                    metrics.recordIdempotencyLookup("redis", true);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for event {}, falling back to database: {}",
                        externalEventId, e.getMessage());
            }
        }

        Optional<UUID> recordId = callRecordService.findByExternalEventId(externalEventId).map(CallRecord::getId);
        metrics.recordIdempotencyLookup("database", recordId.isPresent());
        recordId.ifPresent(id -> cache(externalEventId, id));
        return recordId;
    }

    /**
     * Caches the event as processed. Best effort: the call record row already
     * makes later lookups see it.
     */
    public void markProcessed(String externalEventId, UUID recordId) {
        if (recordId == null) {
            throw new IllegalArgumentException("Record id cannot be null");
        }
        cache(externalEventId, recordId);
    }

    private void cache(String externalEventId, UUID recordId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + externalEventId, recordId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache processed event {} in Redis: {}", externalEventId, e.getMessage());
        }
    }
}
