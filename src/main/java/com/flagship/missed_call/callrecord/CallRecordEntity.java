package com.flagship.missed_call.callrecord;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for call records.
 *
 * Key design principles:
 * - No @Setter: a call record is written once; only the reply fields change,
 *   through a conditional update in the repository
 * - external_event_id is unique at the database level; that constraint is
 *   what stops two racing deliveries of one call from both being recorded
 */
@Entity
@Table(
    name = "call_records",
    indexes = {
        @Index(name = "idx_call_records_customer_caller", columnList = "customer_id, caller_number, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CallRecordEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(name = "external_event_id", nullable = false, unique = true, updatable = false, length = 64)
    private String externalEventId;

    @Column(name = "caller_number", nullable = false, updatable = false, length = 32)
    private String callerNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "response_type", nullable = false, length = 20)
    private ResponseType responseType;

    @Column(name = "response_text", nullable = false, length = 1600)
    private String responseText;

    @Column(name = "delivery_id", length = 64)
    private String deliveryId;

    @Column(name = "delivery_status", length = 32)
    private String deliveryStatus;

    @Column(name = "voicemail_url", length = 1000)
    private String voicemailUrl;

    @Column(name = "transcript", length = 4000)
    private String transcript;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal cost;

    @Column(name = "customer_replied", nullable = false)
    private boolean customerReplied;

    @Column(name = "reply_text", length = 1600)
    private String replyText;

    @Column(name = "reply_cost", nullable = false, precision = 12, scale = 2)
    private BigDecimal replyCost;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static CallRecordEntity fromDomain(CallRecord record) {
        return new CallRecordEntity(
            record.getId() != null ? record.getId() : UUID.randomUUID(),
            record.getCustomerId(),
            record.getExternalEventId(),
            record.getCallerNumber(),
            record.getResponseType(),
            record.getResponseText(),
            record.getDeliveryId(),
            record.getDeliveryStatus(),
            record.getVoicemailUrl(),
            record.getTranscript(),
            record.getCost(),
            false,
            null,
            BigDecimal.ZERO.setScale(2),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public CallRecord toDomain() {
        return CallRecord.builder()
            .id(id)
            .customerId(customerId)
            .externalEventId(externalEventId)
            .callerNumber(callerNumber)
            .responseType(responseType)
            .responseText(responseText)
            .deliveryId(deliveryId)
            .deliveryStatus(deliveryStatus)
            .voicemailUrl(voicemailUrl)
            .transcript(transcript)
            .cost(cost)
            .customerReplied(customerReplied)
            .replyText(replyText)
            .replyCost(replyCost)
            .createdAt(createdAt)
            .build();
    }
}
