package com.flagship.missed_call.outbox;

/**
 * Aggregate and event type names written to the outbox.
 */
public final class OutboxEventTypes {

    public static final String CUSTOMER_AGGREGATE = "Customer";

    public static final String LOW_BALANCE_ALERT = "LowBalanceAlert";
    public static final String RECONCILIATION_REQUIRED = "ReconciliationRequired";
    public static final String MAGIC_LINK_REQUESTED = "MagicLinkRequested";

    private OutboxEventTypes() {
    }
}
