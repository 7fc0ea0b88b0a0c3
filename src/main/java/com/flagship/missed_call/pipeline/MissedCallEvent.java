package com.flagship.missed_call.pipeline;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A missed call as reported by the telephony webhook.
 *
 * externalEventId is the provider's CallSid. calledNumber is the business
 * number the call was forwarded to and is used to find the customer.
 */
@Value
@Builder
public class MissedCallEvent {
    String externalEventId;
    String callerNumber;
    String calledNumber;
    String recordingUrl;
    String transcriptionText;
    Instant receivedAt;

    public boolean hasRecording() {
        return recordingUrl != null && !recordingUrl.isBlank();
    }
}
