package com.flagship.missed_call.webhook;

import com.flagship.missed_call.config.MissedCallProperties;
import com.flagship.missed_call.observability.PipelineMetrics;
import com.flagship.missed_call.ratelimit.ClientIpResolver;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Map;
import java.util.TreeMap;

/**
 * Validates X-Twilio-Signature.
 *
 * Twilio signs the full callback URL followed by every POST parameter, sorted
 * by name, as name + value with no separators, using HMAC-SHA1 keyed with the
 * account auth token. The URL must be the public one Twilio called, so it is
 * rebuilt from the configured base URL rather than from the request, which
 * may have been rewritten by a proxy.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TwilioSignatureValidator {

    public static final String SIGNATURE_HEADER = "X-Twilio-Signature";
    private static final String HMAC_ALGO = "HmacSHA1";

    private final MissedCallProperties properties;
    private final PipelineMetrics metrics;

    @PostConstruct
    void warnIfDisabled() {
        if (!properties.getTwilio().isValidateSignatures()) {
            log.warn("Twilio webhook signature validation is DISABLED; any caller can trigger SMS and charges");
        }
    }

    /**
     * @throws WebhookSignatureException if validation is on and the signature does not match
     */
    public void validate(HttpServletRequest request, Map<String, String> params) {
        if (!properties.getTwilio().isValidateSignatures()) {
            return;
        }
        String url = publicUrl(request);
        String signature = request.getHeader(SIGNATURE_HEADER);
        if (!isValid(url, params, signature)) {
            log.warn("SECURITY: rejected webhook with invalid signature: path={}, remoteIp={}, signaturePresent={}",
                    request.getRequestURI(), ClientIpResolver.resolve(request), signature != null);
            metrics.recordSignatureRejected(request.getRequestURI());
            throw new WebhookSignatureException("Invalid Twilio signature");
        }
    }

    public boolean isValid(String url, Map<String, String> params, String signature) {
        String authToken = properties.getTwilio().getAuthToken();
        if (signature == null || signature.isBlank() || authToken == null || authToken.isBlank()) {
            return false;
        }
        String expected = computeSignature(authToken, url, params);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signature.trim().getBytes(StandardCharsets.UTF_8));
    }

    public static String computeSignature(String authToken, String url, Map<String, String> params) {
        StringBuilder data = new StringBuilder(url);
        new TreeMap<>(params).forEach((name, value) -> data.append(name).append(value != null ? value : ""));
        try {
            Mac mac = Mac.getInstance(HMAC_ALGO);
            mac.init(new SecretKeySpec(authToken.getBytes(StandardCharsets.UTF_8), HMAC_ALGO));
            return Base64.getEncoder().encodeToString(mac.doFinal(data.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 unavailable", e);
        }
    }

    String publicUrl(HttpServletRequest request) {
        String base = properties.getPublicBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String query = request.getQueryString();
        return base + request.getRequestURI() + (query != null ? "?" + query : "");
    }
}
