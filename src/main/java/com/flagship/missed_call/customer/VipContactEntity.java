package com.flagship.missed_call.customer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "vip_contacts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VipContactEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(name = "phone_number", nullable = false, updatable = false, length = 32)
    private String phoneNumber;

    @Column(length = 200)
    private String name;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static VipContactEntity of(UUID customerId, String phoneNumber, String name) {
        VipContactEntity entity = new VipContactEntity();
        entity.id = UUID.randomUUID();
        entity.customerId = customerId;
        entity.phoneNumber = phoneNumber;
        entity.name = name;
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    VipContact toDomain() {
        return VipContact.builder()
                .id(id)
                .customerId(customerId)
                .phoneNumber(phoneNumber)
                .name(name)
                .build();
    }
}
