package com.flagship.missed_call.channel;

import lombok.Value;

/**
 * Provider acknowledgement of an outbound message: its id and initial status
 * (for Twilio typically "queued" or "accepted").
 */
@Value
public class DeliveryReceipt {
    String deliveryId;
    String status;
}
