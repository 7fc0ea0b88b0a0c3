package com.flagship.missed_call.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the missed-call pipeline and the wallet ledger.
 *
 * Metrics exposed:
 * - pipeline.runs: saga outcomes, tagged by pipeline and outcome
 * - pipeline.duration: end-to-end saga time per pipeline
 * - pipeline.duplicates: webhook redeliveries short-circuited by the idempotency guard
 * - pipeline.billing_exceptions: responses sent without a matching charge
 * - pipeline.reconciliation_escalations: refunds that failed after a debit
 * - wallet.postings / wallet.posting.retries: ledger activity
 * - webhook.signature.rejected, ratelimit.rejected: edge defenses
 * - webhook.dispatch.rejected: acknowledged events the saturated executor refused
 * - low_balance.alerts: alerts that passed the cooldown check
 */
@Component
public class PipelineMetrics {

    private final MeterRegistry registry;

    private final Counter duplicates;
    private final Counter reconciliationEscalations;
    private final Counter ledgerRetries;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.duplicates = Counter.builder("pipeline.duplicates")
                .description("Webhook deliveries skipped as duplicates")
                .register(registry);

        this.reconciliationEscalations = Counter.builder("pipeline.reconciliation_escalations")
                .description("Charges that could not be refunded and need manual reconciliation")
                .register(registry);

        this.ledgerRetries = Counter.builder("wallet.posting.retries")
                .description("Optimistic-lock retries on wallet postings")
                .register(registry);
    }

    // ==================== Pipeline ====================

    public void recordPipelineOutcome(String pipeline, String outcome, Duration duration) {
        registry.counter("pipeline.runs",
                "pipeline", sanitizeTag(pipeline),
                "outcome", sanitizeTag(outcome)
        ).increment();
        Timer.builder("pipeline.duration")
                .tag("pipeline", sanitizeTag(pipeline))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    public void incrementDuplicates() {
        duplicates.increment();
    }

    public void recordBillingException(String reason) {
        registry.counter("pipeline.billing_exceptions", "reason", sanitizeTag(reason)).increment();
    }

    public void incrementReconciliationEscalations() {
        reconciliationEscalations.increment();
    }

    public void recordIdempotencyLookup(String source, boolean hit) {
        registry.counter("idempotency.lookup",
                "source", sanitizeTag(source),
                "result", hit ? "hit" : "miss"
        ).increment();
    }

    public void recordLowBalanceAlert(String threshold) {
        registry.counter("low_balance.alerts", "threshold", sanitizeTag(threshold)).increment();
    }

    // ==================== Ledger ====================

    public void recordLedgerPosting(String kind, String outcome) {
        registry.counter("wallet.postings",
                "kind", sanitizeTag(kind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLedgerRetry() {
        ledgerRetries.increment();
    }

    // ==================== Edge ====================

    public void recordSignatureRejected(String endpoint) {
        registry.counter("webhook.signature.rejected", "endpoint", sanitizeTag(endpoint)).increment();
    }

    public void recordDispatchRejected(String pipeline) {
        registry.counter("webhook.dispatch.rejected", "pipeline", sanitizeTag(pipeline)).increment();
    }

    public void recordRateLimited(String endpoint, String scope) {
        registry.counter("ratelimit.rejected",
                "endpoint", sanitizeTag(endpoint),
                "scope", sanitizeTag(scope)
        ).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
