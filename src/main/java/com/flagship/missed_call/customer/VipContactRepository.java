package com.flagship.missed_call.customer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface VipContactRepository extends JpaRepository<VipContactEntity, UUID> {

    Optional<VipContactEntity> findByCustomerIdAndPhoneNumber(UUID customerId, String phoneNumber);
}
