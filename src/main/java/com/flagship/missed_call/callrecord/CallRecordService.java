package com.flagship.missed_call.callrecord;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for call records.
 *
 * create() runs without an outer transaction. A unique-key failure on
 * external_event_id is told apart from other integrity errors by a fresh
 * read after the failed insert.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CallRecordService {

    private final CallRecordRepository repository;

    /**
     * Inserts the record.
     *
     * @throws DuplicateCallRecordException if a record for the same external id exists
     */
    public CallRecord create(CallRecord record) {
        try {
            CallRecord saved = repository.saveAndFlush(CallRecordEntity.fromDomain(record)).toDomain();
            log.debug("Created call record {} for external event {}", saved.getId(), saved.getExternalEventId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            if (repository.existsByExternalEventId(record.getExternalEventId())) {
                throw new DuplicateCallRecordException(record.getExternalEventId(), e);
            }
            throw e;
        }
    }

    @Transactional
    public void delete(UUID recordId) {
        repository.deleteById(recordId);
        log.info("Deleted call record {}", recordId);
    }

    @Transactional(readOnly = true)
    public boolean existsByExternalEventId(String externalEventId) {
        return repository.existsByExternalEventId(externalEventId);
    }

    @Transactional(readOnly = true)
    public Optional<CallRecord> findByExternalEventId(String externalEventId) {
        return repository.findByExternalEventId(externalEventId).map(CallRecordEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<CallRecord> findById(UUID recordId) {
        return repository.findById(recordId).map(CallRecordEntity::toDomain);
    }

    /**
     * Whether this caller has called the customer before.
     */
    @Transactional(readOnly = true)
    public boolean hasPreviousCall(UUID customerId, String callerNumber) {
        return callerNumber != null && repository.existsByCustomerIdAndCallerNumber(customerId, callerNumber);
    }

    @Transactional(readOnly = true)
    public Optional<CallRecord> findLatestUnreplied(UUID customerId, String callerNumber) {
        return repository
            .findFirstByCustomerIdAndCallerNumberAndCustomerRepliedFalseOrderByCreatedAtDesc(customerId, callerNumber)
            .map(CallRecordEntity::toDomain);
    }

    /**
     * Attaches a caller's reply to the record and adds its cost.
     *
     * @throws IllegalStateException if the record already has a reply
     */
    @Transactional
    public void markReplied(UUID recordId, String replyText, BigDecimal replyCost) {
        int updated = repository.markReplied(recordId, replyText, replyCost, Instant.now());
        if (updated == 0) {
            throw new IllegalStateException("Call record " + recordId + " already has a reply");
        }
    }
}
