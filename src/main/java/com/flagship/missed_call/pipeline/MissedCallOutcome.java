package com.flagship.missed_call.pipeline;

/**
 * How a missed-call event ended. Used for logging, metrics and tests.
 */
public enum MissedCallOutcome {
    PROCESSED,
    DUPLICATE,
    UNKNOWN_CUSTOMER,
    BELOW_MINIMUM_BALANCE,
    /** Response was sent but the wallet could not cover it. */
    INSUFFICIENT_FUNDS,
    SEND_FAILED,
    /** Pipeline executor was saturated; the event was acknowledged but not run. */
    REJECTED,
    FAILED
}
