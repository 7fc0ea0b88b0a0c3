package com.flagship.missed_call.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Oldest relayable events. The row locks last only as long as the calling
     * transaction: {@link OutboxService#findPendingEvents} commits before the
     * batch is sent, so SKIP LOCKED only keeps two concurrent reads apart. A
     * second publisher can still pick up an event that is mid-send; delivery
     * is at least once and {@link #markPublished} is a no-op the second time.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL AND retry_count < :maxRetries
        ORDER BY sequence_number ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> lockRelayBatch(@Param("maxRetries") int maxRetries,
                                           @Param("limit") int limit);

    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
        String aggregateType, UUID aggregateId);

    List<OutboxEventEntity> findByEventTypeOrderBySequenceNumberAsc(String eventType);

    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE OutboxEventEntity e
        SET e.publishedAt = :now, e.lastError = null
        WHERE e.id = :id AND e.publishedAt IS NULL
        """)
    int markPublished(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE OutboxEventEntity e
        SET e.retryCount = e.retryCount + 1, e.lastError = :error
        WHERE e.id = :id AND e.publishedAt IS NULL
        """)
    int recordFailure(@Param("id") UUID id, @Param("error") String error);

    long countByPublishedAtIsNull();

    /** Events the publisher has given up on. */
    long countByPublishedAtIsNullAndRetryCountGreaterThanEqual(int retryCount);

    @Query("SELECT MIN(e.createdAt) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    Optional<Instant> findOldestUnpublishedCreatedAt();

    @Modifying
    @Query("DELETE FROM OutboxEventEntity e WHERE e.publishedAt < :before")
    int deletePublishedBefore(@Param("before") Instant before);
}
