package com.flagship.missed_call.channel;

/**
 * Outbound SMS channel. A successful return means the provider accepted the
 * message; there is no way to take it back afterwards.
 */
public interface MessageSender {

    /**
     * @throws MessageDeliveryException if the provider rejected the message or did not answer in time
     */
    DeliveryReceipt send(String from, String to, String body);
}
