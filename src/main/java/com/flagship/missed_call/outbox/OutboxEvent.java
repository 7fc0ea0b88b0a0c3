package com.flagship.missed_call.outbox;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A billing or account notification waiting in outbox_events to be relayed
 * to Kafka by {@link OutboxPublisher}.
 *
 * aggregateId is the customer and doubles as the record key. correlationId
 * is the id of the request that caused the event, carried as a record header.
 */
@Value
@Builder(toBuilder = true)
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    String correlationId;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    /** Insertion order; assigned by the database. */
    Long sequenceNumber;

    public boolean isPublished() {
        return publishedAt != null;
    }
}
