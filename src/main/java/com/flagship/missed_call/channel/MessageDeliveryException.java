package com.flagship.missed_call.channel;

import lombok.Getter;

/**
 * Outbound message could not be handed to the provider (error status,
 * timeout, connection failure). Nothing was sent as far as we know.
 */
@Getter
public class MessageDeliveryException extends RuntimeException {

    private final int httpStatus;

    public MessageDeliveryException(String message) {
        super(message);
        this.httpStatus = 0;
    }

    public MessageDeliveryException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public MessageDeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = 0;
    }
}
