package com.flagship.missed_call.customer;

import com.flagship.missed_call.wallet.WalletLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Customer lookups used by the webhooks, plus the few writes the core needs:
 * registration (with an empty wallet) and pause/resume.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerService {

    private final CustomerRepository repository;
    private final VipContactRepository vipContactRepository;
    private final WalletLedgerService ledgerService;

    /**
     * Persists a customer and opens an empty wallet for it.
     */
    public Customer register(Customer customer) {
        Customer saved = repository.saveAndFlush(CustomerEntity.fromDomain(customer)).toDomain();
        ledgerService.createWallet(saved.getId());
        log.info("Registered customer {} for number {}", saved.getId(), saved.getPhoneNumber());
        return saved;
    }

    /**
     * Customer owning the called number, if verified and active.
     * Calls to anyone else are not ours to answer.
     */
    @Transactional(readOnly = true)
    public Optional<Customer> findServiceableByPhoneNumber(String phoneNumber) {
        return findByPhoneNumber(phoneNumber)
            .filter(Customer::isVerified)
            .filter(Customer::isActive);
    }

    @Transactional(readOnly = true)
    public Optional<Customer> findByPhoneNumber(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.isBlank()) {
            return Optional.empty();
        }
        return repository.findByPhoneNumber(phoneNumber.trim()).map(CustomerEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Customer> findByEmail(String email) {
        return repository.findByEmail(email.trim().toLowerCase()).map(CustomerEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Customer getById(UUID customerId) {
        return repository.findById(customerId)
            .map(CustomerEntity::toDomain)
            .orElseThrow(() -> new CustomerNotFoundException(customerId));
    }

    /**
     * VIP entry for a caller of this customer, matched on the trimmed number.
     */
    @Transactional(readOnly = true)
    public Optional<VipContact> findVipContact(UUID customerId, String callerNumber) {
        if (callerNumber == null || callerNumber.isBlank()) {
            return Optional.empty();
        }
        return vipContactRepository.findByCustomerIdAndPhoneNumber(customerId, callerNumber.trim())
            .map(VipContactEntity::toDomain);
    }

    @Transactional
    public VipContact addVipContact(UUID customerId, String phoneNumber, String name) {
        if (!repository.existsById(customerId)) {
            throw new CustomerNotFoundException(customerId);
        }
        if (phoneNumber == null || phoneNumber.isBlank()) {
            throw new IllegalArgumentException("VIP phone number cannot be blank");
        }
        VipContact saved = vipContactRepository.save(
            VipContactEntity.of(customerId, phoneNumber.trim(), name)).toDomain();
        log.info("Added VIP contact {} for customer {}", saved.getPhoneNumber(), customerId);
        return saved;
    }

    @Transactional
    public Customer setActive(UUID customerId, boolean active) {
        CustomerEntity entity = repository.findById(customerId)
            .orElseThrow(() -> new CustomerNotFoundException(customerId));
        entity.setActive(active);
        log.info("Customer {} {}", customerId, active ? "resumed" : "paused");
        return repository.save(entity).toDomain();
    }
}
