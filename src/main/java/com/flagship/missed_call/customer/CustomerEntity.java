package com.flagship.missed_call.customer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for customers.
 *
 * No setters: only the active flag changes after creation, through
 * {@link #setActive(boolean)}.
 */
@Entity
@Table(name = "customers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CustomerEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "business_name", nullable = false, length = 200)
    private String businessName;

    @Column(name = "phone_number", nullable = false, unique = true, length = 32)
    private String phoneNumber;

    @Column(nullable = false)
    private boolean verified;

    @Column(nullable = false, length = 64)
    private String timezone;

    @Column(name = "hours_start", nullable = false, length = 5)
    private String hoursStart;

    @Column(name = "hours_end", nullable = false, length = 5)
    private String hoursEnd;

    @Column(name = "days_open", nullable = false, length = 20)
    private String daysOpen;

    @Column(name = "greeting_url", length = 1000)
    private String greetingUrl;

    @Column(name = "custom_message", length = 1600)
    private String customMessage;

    @Column(name = "two_way_enabled", nullable = false)
    private boolean twoWayEnabled;

    @Column(name = "transcription_enabled", nullable = false)
    private boolean transcriptionEnabled;

    @Column(name = "sequences_enabled", nullable = false)
    private boolean sequencesEnabled;

    @Column(name = "recognition_enabled", nullable = false)
    private boolean recognitionEnabled;

    @Column(name = "vip_priority_enabled", nullable = false)
    private boolean vipPriorityEnabled;

    @Column(nullable = false)
    private boolean active;

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

    static CustomerEntity fromDomain(Customer customer) {
        BusinessHours hours = customer.getBusinessHours();
        return new CustomerEntity(
            customer.getId() != null ? customer.getId() : UUID.randomUUID(),
            customer.getEmail().trim().toLowerCase(),
            customer.getBusinessName(),
            customer.getPhoneNumber(),
            customer.isVerified(),
            hours.getZone().getId(),
            hours.getStart().toString(),
            hours.getEnd().toString(),
            hours.daysOpenAsString(),
            customer.getGreetingUrl(),
            customer.getCustomMessage(),
            customer.isTwoWayEnabled(),
            customer.isTranscriptionEnabled(),
            customer.isSequencesEnabled(),
            customer.isRecognitionEnabled(),
            customer.isVipPriorityEnabled(),
            customer.isActive(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Customer toDomain() {
        return Customer.builder()
            .id(id)
            .email(email)
            .businessName(businessName)
            .phoneNumber(phoneNumber)
            .verified(verified)
            .businessHours(BusinessHours.parse(timezone, hoursStart, hoursEnd, daysOpen))
            .greetingUrl(greetingUrl)
            .customMessage(customMessage)
            .twoWayEnabled(twoWayEnabled)
            .transcriptionEnabled(transcriptionEnabled)
            .sequencesEnabled(sequencesEnabled)
            .recognitionEnabled(recognitionEnabled)
            .vipPriorityEnabled(vipPriorityEnabled)
            .active(active)
            .build();
    }

    void setActive(boolean active) {
        this.active = active;
    }
}
