package com.flagship.missed_call.outbox;

import com.flagship.missed_call.BaseIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OutboxServiceTest extends BaseIntegrationTest {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private OutboxEvent saveInTransaction(UUID aggregateId, String type) {
        return new TransactionTemplate(transactionManager).execute(status ->
                outboxService.saveEvent(OutboxEventTypes.CUSTOMER_AGGREGATE, aggregateId, type,
                        Map.of("customerId", aggregateId.toString())));
    }

    @Test
    @DisplayName("Saving outside a transaction is refused")
    void testSaveRequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class, () ->
                outboxService.saveEvent(OutboxEventTypes.CUSTOMER_AGGREGATE, UUID.randomUUID(),
                        OutboxEventTypes.LOW_BALANCE_ALERT, Map.of("x", 1)));
        assertEquals(0, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Saved event is pending with a JSON payload")
    void testSaveEvent() {
        UUID aggregateId = UUID.randomUUID();

        saveInTransaction(aggregateId, OutboxEventTypes.LOW_BALANCE_ALERT);

        List<OutboxEvent> events = outboxService.getEventsForAggregate(OutboxEventTypes.CUSTOMER_AGGREGATE, aggregateId);
        assertEquals(1, events.size());
        OutboxEvent event = events.get(0);
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());
        assertEquals("{\"customerId\":\"" + aggregateId + "\"}", event.getPayload());
        assertEquals(1, outboxService.findPendingEvents(5, 100).size());
    }

    @Test
    @DisplayName("Batch read does not hold its rows: a second relay sees the same event, publishing twice is harmless")
    void testBatchReadReleasesRows() throws Exception {
        // Given
        UUID aggregateId = UUID.randomUUID();
        OutboxEvent event = saveInTransaction(aggregateId, OutboxEventTypes.LOW_BALANCE_ALERT);

        // When: two relays read before either marks the event published
        List<OutboxEvent> first = outboxService.findPendingEvents(5, 100);
        List<OutboxEvent> second = CompletableFuture
                .supplyAsync(() -> outboxService.findPendingEvents(5, 100))
                .get(10, TimeUnit.SECONDS);
        outboxService.markPublished(event.getId());
        outboxService.markPublished(event.getId());

        // Then
        assertEquals(List.of(event.getId()), first.stream().map(OutboxEvent::getId).toList());
        assertEquals(List.of(event.getId()), second.stream().map(OutboxEvent::getId).toList());
        assertTrue(outboxService.findPendingEvents(5, 100).isEmpty());
        assertTrue(outboxService.getEventsForAggregate(OutboxEventTypes.CUSTOMER_AGGREGATE, aggregateId)
                .get(0).isPublished());
    }

    @Test
    @DisplayName("Rolled back transaction leaves no event behind")
    void testRollback() {
        UUID aggregateId = UUID.randomUUID();

        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            outboxService.saveEvent(OutboxEventTypes.CUSTOMER_AGGREGATE, aggregateId,
                    OutboxEventTypes.LOW_BALANCE_ALERT, Map.of("x", 1));
            status.setRollbackOnly();
        });

        assertTrue(outboxService.getEventsForAggregate(OutboxEventTypes.CUSTOMER_AGGREGATE, aggregateId).isEmpty());
    }

    @Test
    @DisplayName("Failures count up and drop the event from the pending batch at the retry limit")
    void testMarkFailed() {
        UUID aggregateId = UUID.randomUUID();
        OutboxEvent event = saveInTransaction(aggregateId, OutboxEventTypes.RECONCILIATION_REQUIRED);

        outboxService.markFailed(event.getId(), "broker unavailable");
        outboxService.markFailed(event.getId(), "broker unavailable");

        OutboxEvent reloaded = outboxService.getEventsOfType(OutboxEventTypes.RECONCILIATION_REQUIRED).get(0);
        assertEquals(2, reloaded.getRetryCount());
        assertEquals("broker unavailable", reloaded.getLastError());
        assertEquals(1, outboxService.findPendingEvents(5, 100).size());
        assertTrue(outboxService.findPendingEvents(2, 100).isEmpty());
    }

    @Test
    @DisplayName("Published events leave the pending batch and can be purged")
    void testPublishAndPurge() {
        OutboxEvent published = saveInTransaction(UUID.randomUUID(), OutboxEventTypes.MAGIC_LINK_REQUESTED);
        saveInTransaction(UUID.randomUUID(), OutboxEventTypes.MAGIC_LINK_REQUESTED);

        outboxService.markPublished(published.getId());

        assertEquals(1, outboxService.countUnpublished());
        assertEquals(1, outboxService.findPendingEvents(5, 100).size());
        assertEquals(0, outboxService.purgePublishedBefore(Instant.now().minusSeconds(3600)));
        assertEquals(1, outboxService.purgePublishedBefore(Instant.now().plusSeconds(1)));
        assertEquals(1, outboxService.getEventsOfType(OutboxEventTypes.MAGIC_LINK_REQUESTED).size());
    }
}
