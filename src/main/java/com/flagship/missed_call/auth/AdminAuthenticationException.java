package com.flagship.missed_call.auth;

/**
 * Missing or wrong admin credentials. Mapped to 401.
 */
public class AdminAuthenticationException extends RuntimeException {

    public AdminAuthenticationException(String message) {
        super(message);
    }
}
