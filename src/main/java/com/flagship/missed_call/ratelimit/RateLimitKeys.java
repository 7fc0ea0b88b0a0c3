package com.flagship.missed_call.ratelimit;

import java.util.Locale;

/**
 * Builds counter keys of the form endpoint:type:value.
 */
public final class RateLimitKeys {

    static final int MAX_VALUE_LENGTH = 200;

    public static final String MAGIC_LINK = "magic-link";
    public static final String ADMIN_LOGIN = "admin-login";

    public static final String EMAIL = "email";
    public static final String IP = "ip";

    private RateLimitKeys() {
    }

    public static String key(String endpoint, String type, String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() > MAX_VALUE_LENGTH) {
            normalized = normalized.substring(0, MAX_VALUE_LENGTH);
        }
        return endpoint + ":" + type + ":" + normalized;
    }
}
