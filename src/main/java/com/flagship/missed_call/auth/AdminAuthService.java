package com.flagship.missed_call.auth;

import com.flagship.missed_call.config.MissedCallProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Single shared admin password, configured as its hex SHA-256.
 *
 * The session cookie carries that same hash; every admin request compares
 * it to the configured one in constant time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminAuthService {

    public static final String COOKIE_NAME = "admin_auth";

    private final MissedCallProperties properties;

    /**
     * @return the value for the session cookie
     * @throws AdminAuthNotConfiguredException if no hash is configured
     * @throws AdminAuthenticationException if the password is wrong
     */
    public String login(String password) {
        String expected = configuredHash();
        if (!constantTimeEquals(sha256Hex(password), expected)) {
            throw new AdminAuthenticationException("Invalid password");
        }
        return expected;
    }

    /**
     * @throws AdminAuthenticationException unless the cookie value matches the configured hash
     */
    public void requireAdmin(String cookieValue) {
        String expected = properties.getAdmin().getPasswordHash();
        if (expected == null || expected.isBlank() || cookieValue == null || cookieValue.isBlank()) {
            throw new AdminAuthenticationException("Admin authentication required");
        }
        if (!constantTimeEquals(cookieValue.trim().toLowerCase(Locale.ROOT), expected.trim().toLowerCase(Locale.ROOT))) {
            throw new AdminAuthenticationException("Admin authentication required");
        }
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private String configuredHash() {
        String hash = properties.getAdmin().getPasswordHash();
        if (hash == null || hash.isBlank()) {
            log.error("Admin login attempted but missed-call.admin.password-hash is not set");
            throw new AdminAuthNotConfiguredException();
        }
        return hash.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
