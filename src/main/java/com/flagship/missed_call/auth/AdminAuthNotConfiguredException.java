package com.flagship.missed_call.auth;

/**
 * No admin password hash is configured, so nobody can log in.
 */
public class AdminAuthNotConfiguredException extends RuntimeException {

    public AdminAuthNotConfiguredException() {
        super("Admin authentication is not configured");
    }
}
