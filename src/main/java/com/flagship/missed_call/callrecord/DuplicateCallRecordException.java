package com.flagship.missed_call.callrecord;

/**
 * A record for this external event id already exists. Raised to the loser
 * of two concurrent deliveries of the same call.
 */
public class DuplicateCallRecordException extends RuntimeException {

    public DuplicateCallRecordException(String externalEventId, Throwable cause) {
        super("Call record already exists for external event " + externalEventId, cause);
    }
}
