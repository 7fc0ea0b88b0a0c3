package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.observability.PipelineMetrics;
import com.flagship.missed_call.outbox.OutboxEventTypes;
import com.flagship.missed_call.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Hands a charge that could not be refunded over to a human.
 *
 * The ERROR line carries the RECONCILIATION marker for log-based alerting;
 * the outbox event feeds the billing-alerts topic. The outbox write is
 * attempted even when the ledger is the thing that is failing, and a failure
 * there still leaves the log line.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationEscalator {

    public static final Marker RECONCILIATION = MarkerFactory.getMarker("RECONCILIATION");

    private final OutboxService outboxService;
    private final PlatformTransactionManager transactionManager;
    private final PipelineMetrics metrics;

    public void escalate(UUID customerId, String externalEventId, BigDecimal amount, String reason, Throwable cause) {
        log.error(RECONCILIATION,
                "Manual reconciliation required: customer={}, externalEventId={}, amount={}, reason={}",
                customerId, externalEventId, amount, reason, cause);
        metrics.incrementReconciliationEscalations();

        try {
            new TransactionTemplate(transactionManager).executeWithoutResult(status ->
                    outboxService.saveEvent(
                            OutboxEventTypes.CUSTOMER_AGGREGATE,
                            customerId,
                            OutboxEventTypes.RECONCILIATION_REQUIRED,
                            new ReconciliationRequired(customerId, externalEventId, amount, reason,
                                    cause != null ? cause.getMessage() : null, Instant.now())));
        } catch (RuntimeException e) {
            log.error(RECONCILIATION, "Could not queue reconciliation event for {} ({}); the log line above is the only record",
                    externalEventId, customerId, e);
        }
    }

    @Value
    static class ReconciliationRequired {
        UUID customerId;
        String externalEventId;
        BigDecimal amount;
        String reason;
        String error;
        Instant detectedAt;
    }
}
