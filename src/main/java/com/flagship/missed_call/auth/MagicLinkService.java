package com.flagship.missed_call.auth;

import com.flagship.missed_call.config.MissedCallProperties;
import com.flagship.missed_call.customer.Customer;
import com.flagship.missed_call.customer.CustomerService;
import com.flagship.missed_call.observability.PipelineMetrics;
import com.flagship.missed_call.outbox.OutboxEventTypes;
import com.flagship.missed_call.outbox.OutboxService;
import com.flagship.missed_call.ratelimit.RateLimitDecision;
import com.flagship.missed_call.ratelimit.RateLimitKeys;
import com.flagship.missed_call.ratelimit.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Queues sign-in links. Throttled per email and per client IP; a throttled
 * or unknown address gets no link and no indication why.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MagicLinkService {

    private final RateLimiter rateLimiter;
    private final CustomerService customerService;
    private final OutboxService outboxService;
    private final MissedCallProperties properties;
    private final PipelineMetrics metrics;

    /**
     * @return true if a link was queued
     */
    @Transactional
    public boolean requestLink(String email, String clientIp) {
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        MissedCallProperties.RateLimit limits = properties.getRateLimit();

        RateLimitDecision byEmail = rateLimiter.check(
                RateLimitKeys.key(RateLimitKeys.MAGIC_LINK, RateLimitKeys.EMAIL, normalized),
                limits.getMagicLinkPerEmail(), limits.getWindow());
        RateLimitDecision byIp = rateLimiter.check(
                RateLimitKeys.key(RateLimitKeys.MAGIC_LINK, RateLimitKeys.IP, clientIp),
                limits.getMagicLinkPerIp(), limits.getWindow());

        if (!byEmail.isAllowed() || !byIp.isAllowed()) {
            String scope = !byEmail.isAllowed() ? RateLimitKeys.EMAIL : RateLimitKeys.IP;
            log.warn("Magic link rate limit exceeded ({}) for ip {}", scope, clientIp);
            metrics.recordRateLimited(RateLimitKeys.MAGIC_LINK, scope);
            return false;
        }

        Optional<Customer> customer = customerService.findByEmail(normalized);
        if (customer.isEmpty()) {
            log.info("Magic link requested for unknown address from ip {}", clientIp);
            return false;
        }

        outboxService.saveEvent(
                OutboxEventTypes.CUSTOMER_AGGREGATE,
                customer.get().getId(),
                OutboxEventTypes.MAGIC_LINK_REQUESTED,
                new MagicLinkRequested(customer.get().getId(), normalized, clientIp, Instant.now()));
        log.info("Magic link queued for customer {}", customer.get().getId());
        return true;
    }

    @Value
    static class MagicLinkRequested {
        UUID customerId;
        String email;
        String requestedFromIp;
        Instant requestedAt;
    }
}
