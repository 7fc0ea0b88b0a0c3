package com.flagship.missed_call.observability;

import java.util.UUID;

/**
 * MDC keys and header names shared by the request filter, the pipelines and
 * the log pattern.
 *
 * MDC is the only carrier: the pipeline executor copies it onto worker
 * threads, so a webhook's request id stays on every line of the missed call
 * it triggered.
 */
public final class CorrelationContext {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    /** CallSid or MessageSid of the event being processed. */
    public static final String CALL_SID_MDC_KEY = "callSid";
    public static final String CUSTOMER_ID_MDC_KEY = "customerId";

    private static final int MAX_INBOUND_LENGTH = 64;

    private CorrelationContext() {
    }

    /**
     * The caller's id if it is usable, otherwise a fresh short one.
     */
    public static String resolve(String inbound) {
        if (inbound == null || inbound.isBlank() || inbound.length() > MAX_INBOUND_LENGTH) {
            return newId();
        }
        return inbound.trim();
    }

    public static String newId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
