package com.flagship.missed_call.pipeline;

public enum ReplyOutcome {
    RECORDED,
    DUPLICATE,
    UNKNOWN_CUSTOMER,
    TWO_WAY_DISABLED,
    NO_OPEN_CALL,
    INSUFFICIENT_FUNDS,
    REJECTED,
    FAILED
}
