package com.flagship.missed_call.callrecord;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Auditable record of one processed missed call.
 *
 * externalEventId is the provider's CallSid and is unique: a redelivered
 * webhook resolves to this record instead of creating another.
 */
@Value
@Builder(toBuilder = true)
public class CallRecord {
    UUID id;
    UUID customerId;
    String externalEventId;
    String callerNumber;
    ResponseType responseType;
    String responseText;
    String deliveryId;
    String deliveryStatus;
    String voicemailUrl;
    String transcript;
    BigDecimal cost;
    boolean customerReplied;
    String replyText;
    BigDecimal replyCost;
    Instant createdAt;
}
