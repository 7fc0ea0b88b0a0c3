package com.flagship.missed_call.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.missed_call.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outbox access for producers (alerts, escalations, magic links) and for
 * the relay.
 *
 * Producers must already be in a transaction: the event commits or rolls
 * back with the change it reports. Relay bookkeeping commits on its own so a
 * Kafka failure mid-batch keeps what was already sent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    static final int MAX_ERROR_LENGTH = 2000;

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Queues a JSON-serialized payload, tagged with the current correlation id.
     *
     * @throws org.springframework.transaction.IllegalTransactionStateException outside a transaction
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, String eventType, Object payload) {
        OutboxEventEntity entity = OutboxEventEntity.pending(aggregateType, aggregateId, eventType,
                toJson(payload), MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        OutboxEvent saved = repository.save(entity).toDomain();
        log.debug("Queued {} for {} {}", eventType, aggregateType, aggregateId);
        return saved;
    }

    /**
     * Reads a relay batch in its own short transaction. Rows are not held
     * after this returns; see {@link OutboxEventRepository#lockRelayBatch}.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPendingEvents(int maxRetries, int limit) {
        return repository.lockRelayBatch(maxRetries, limit).stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        if (repository.markPublished(eventId, Instant.now()) == 0) {
            log.warn("Outbox event {} was already published or is gone", eventId);
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        String error = errorMessage != null && errorMessage.length() > MAX_ERROR_LENGTH
                ? errorMessage.substring(0, MAX_ERROR_LENGTH)
                : errorMessage;
        repository.recordFailure(eventId, error);
        log.warn("Outbox event {} failed to publish: {}", eventId, error);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsOfType(String eventType) {
        return repository.findByEventTypeOrderBySequenceNumberAsc(eventType).stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countByPublishedAtIsNull();
    }

    @Transactional
    public int purgePublishedBefore(Instant cutoff) {
        return repository.deletePublishedBefore(cutoff);
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Outbox payload is not serializable: "
                    + payload.getClass().getSimpleName(), e);
        }
    }
}
