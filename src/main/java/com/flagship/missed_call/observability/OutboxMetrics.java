package com.flagship.missed_call.observability;

import com.flagship.missed_call.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox relay meters.
 *
 * Gauges (pending, oldest pending age, exhausted) serve cached values that a
 * scheduled refresh recomputes, so a Prometheus scrape never queries the
 * database. Counters are per event type.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong exhausted = new AtomicLong();

    @PostConstruct
    void registerGauges() {
        Gauge.builder("outbox.pending", pending, AtomicLong::get)
                .description("Billing alert events not yet relayed to Kafka")
                .register(meterRegistry);
        Gauge.builder("outbox.pending.oldest.age.seconds", oldestPendingSeconds, AtomicLong::get)
                .description("How long the oldest unrelayed event has been waiting")
                .baseUnit("seconds")
                .register(meterRegistry);
        Gauge.builder("outbox.exhausted", exhausted, AtomicLong::get)
                .description("Unrelayed events that used up their retries and need a manual replay")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        try {
            pending.set(outboxRepository.countByPublishedAtIsNull());
            oldestPendingSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).toSeconds()))
                    .orElse(0L));
            exhausted.set(outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries));
        } catch (RuntimeException e) {
            log.warn("Outbox gauges not refreshed, keeping previous values: {}", e.getMessage());
        }
    }

    public long pending() {
        return pending.get();
    }

    public long oldestPendingSeconds() {
        return oldestPendingSeconds.get();
    }

    public long exhausted() {
        return exhausted.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.relay", "event_type", eventType, "result", "acked").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.relay", "event_type", eventType, "result", "failed").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.relay", "event_type", eventType, "result", "exhausted").increment();
    }
}
