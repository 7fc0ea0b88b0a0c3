package com.flagship.missed_call.webhook;

import java.util.Map;

/**
 * Field access on provider form posts.
 */
final class WebhookParams {

    private WebhookParams() {
    }

    /**
     * @throws IllegalArgumentException if the field is absent or blank
     */
    static String required(Map<String, String> params, String name) {
        String value = params.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required field: " + name);
        }
        return value.trim();
    }

    static String optional(Map<String, String> params, String name) {
        String value = params.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
