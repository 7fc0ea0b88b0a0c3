package com.flagship.missed_call.webhook;

/**
 * Webhook request whose provider signature is missing or wrong. Mapped to 403.
 */
public class WebhookSignatureException extends RuntimeException {

    public WebhookSignatureException(String message) {
        super(message);
    }
}
