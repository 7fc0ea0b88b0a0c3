package com.flagship.missed_call.callrecord;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CallRecordRepository extends JpaRepository<CallRecordEntity, UUID> {

    boolean existsByExternalEventId(String externalEventId);

    Optional<CallRecordEntity> findByExternalEventId(String externalEventId);

    boolean existsByCustomerIdAndCallerNumber(UUID customerId, String callerNumber);

    /**
     * Most recent call from this caller that has not been replied to yet.
     */
    Optional<CallRecordEntity> findFirstByCustomerIdAndCallerNumberAndCustomerRepliedFalseOrderByCreatedAtDesc(
        UUID customerId, String callerNumber);

    /**
     * Records a reply at most once: the customerReplied = false guard makes
     * a concurrent second reply update zero rows.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE CallRecordEntity c
        SET c.customerReplied = true,
            c.replyText = :replyText,
            c.replyCost = :replyCost,
            c.cost = c.cost + :replyCost,
            c.updatedAt = :now
        WHERE c.id = :id AND c.customerReplied = false
        """)
    int markReplied(@Param("id") UUID id,
                    @Param("replyText") String replyText,
                    @Param("replyCost") BigDecimal replyCost,
                    @Param("now") Instant now);
}
