package com.flagship.missed_call.auth;

import com.flagship.missed_call.auth.dto.AdminLoginRequest;
import com.flagship.missed_call.config.MissedCallProperties;
import com.flagship.missed_call.observability.PipelineMetrics;
import com.flagship.missed_call.ratelimit.ClientIpResolver;
import com.flagship.missed_call.ratelimit.RateLimitDecision;
import com.flagship.missed_call.ratelimit.RateLimitKeys;
import com.flagship.missed_call.ratelimit.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;

/**
 * Admin login and logout.
 *
 * Login is throttled per client IP. Unlike the magic-link endpoint the
 * throttle is visible: 429 with Retry-After.
 */
@RestController
@RequestMapping("/api/admin/auth")
@RequiredArgsConstructor
@Slf4j
public class AdminAuthController {

    static final String TOO_MANY_ATTEMPTS = "Too many attempts. Try again later.";

    private final AdminAuthService authService;
    private final RateLimiter rateLimiter;
    private final MissedCallProperties properties;
    private final PipelineMetrics metrics;

    @PostMapping
    public ResponseEntity<Map<String, Object>> login(@RequestBody(required = false) AdminLoginRequest body,
                                                     HttpServletRequest request) {
        String ip = ClientIpResolver.resolve(request);
        MissedCallProperties.RateLimit limits = properties.getRateLimit();

        RateLimitDecision decision = rateLimiter.check(
                RateLimitKeys.key(RateLimitKeys.ADMIN_LOGIN, RateLimitKeys.IP, ip),
                limits.getAdminLoginPerIp(),
                limits.getWindow());
        if (!decision.isAllowed()) {
            log.warn("Admin login rate limit exceeded for ip {}", ip);
            metrics.recordRateLimited(RateLimitKeys.ADMIN_LOGIN, RateLimitKeys.IP);
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(limits.getWindow().toSeconds()))
                    .body(Map.of("error", TOO_MANY_ATTEMPTS));
        }

        if (body == null || body.getPassword() == null || body.getPassword().isEmpty()) {
            throw new IllegalArgumentException("Password is required");
        }

        String token = authService.login(body.getPassword());
        log.info("Admin login from ip {}", ip);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie(token, properties.getAdmin().getCookieMaxAge()).toString())
                .body(Map.of("success", true));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> logout() {
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie("", Duration.ZERO).toString())
                .body(Map.of("success", true));
    }

    private static ResponseCookie cookie(String value, Duration maxAge) {
        return ResponseCookie.from(AdminAuthService.COOKIE_NAME, value)
                .httpOnly(true)
                .secure(true)
                .sameSite("Strict")
                .path("/")
                .maxAge(maxAge)
                .build();
    }
}
