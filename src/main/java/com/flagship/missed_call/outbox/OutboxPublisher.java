package com.flagship.missed_call.outbox;

import com.flagship.missed_call.observability.CorrelationContext;
import com.flagship.missed_call.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relays outbox events to the billing-alerts topic.
 *
 * Every poll locks a batch, sends each event and waits for the broker ack
 * before marking it published, so delivery is at least once. Records are
 * keyed by customer id and carry the event type and the originating
 * correlation id as headers. An event that fails max-retries times stays in
 * the table, counted by {@link OutboxMetrics} as exhausted.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "event-type";
    static final String EVENT_ID_HEADER = "event-id";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.billing-alerts:billing-alerts}")
    private String billingAlertsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Value("${outbox.publisher.retention:7d}")
    private Duration retention;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.findPendingEvents(maxRetries, batchSize);
        } catch (RuntimeException e) {
            log.error("Could not read outbox batch", e);
            return;
        }
        if (!batch.isEmpty()) {
            log.debug("Relaying {} outbox events", batch.size());
            batch.forEach(this::publish);
        }
    }

    @Scheduled(cron = "${outbox.publisher.cleanup-cron:0 30 3 * * *}")
    public void purgePublishedEvents() {
        int deleted = outboxService.purgePublishedBefore(Instant.now().minus(retention));
        if (deleted > 0) {
            log.info("Purged {} outbox events published before the {} retention", deleted, retention);
        }
    }

    void publish(OutboxEvent event) {
        if (event.getCorrelationId() != null) {
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, event.getCorrelationId());
        }
        try {
            RecordMetadata metadata = kafkaTemplate.send(toRecord(event))
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS)
                    .getRecordMetadata();
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Relayed {} {} to {}-{}@{}", event.getEventType(), event.getId(),
                    metadata.topic(), metadata.partition(), metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed(event, "interrupted");
        } catch (ExecutionException e) {
            failed(event, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (TimeoutException e) {
            failed(event, "no ack within " + sendTimeoutMs + "ms");
        } catch (RuntimeException e) {
            failed(event, e.getMessage());
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    private ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(billingAlertsTopic, event.getAggregateId().toString(), event.getPayload());
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        record.headers().add(EVENT_ID_HEADER, event.getId().toString().getBytes(StandardCharsets.UTF_8));
        if (event.getCorrelationId() != null) {
            record.headers().add(CorrelationContext.REQUEST_ID_HEADER,
                    event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }
        return record;
    }

    private void failed(OutboxEvent event, String reason) {
        log.error("Relay of {} {} for customer {} failed: {}",
                event.getEventType(), event.getId(), event.getAggregateId(), reason);
        outboxService.markFailed(event.getId(), reason);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Outbox event {} exhausted {} attempts and needs manual replay", event.getId(), maxRetries);
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
