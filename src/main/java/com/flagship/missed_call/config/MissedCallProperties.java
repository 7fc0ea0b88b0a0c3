package com.flagship.missed_call.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed configuration for the missed-call pipeline.
 *
 * Bound from application.yml under prefix "missed-call". Secrets (Twilio auth
 * token, admin password hash) come from the environment and are never logged.
 */
@ConfigurationProperties(prefix = "missed-call")
@Data
public class MissedCallProperties {

    /** Public base URL the provider calls us on; used for signature validation and TwiML callbacks. */
    private String publicBaseUrl = "http://localhost:8080";

    private Twilio twilio = new Twilio();
    private Pricing pricing = new Pricing();
    private Alerts alerts = new Alerts();
    private RateLimit rateLimit = new RateLimit();
    private Admin admin = new Admin();
    private Async async = new Async();

    @Data
    public static class Twilio {
        private String accountSid;

        /** Shared secret for request signatures and REST basic auth. */
        private String authToken;

        private String apiBaseUrl = "https://api.twilio.com";

        private boolean validateSignatures = true;

        private int connectTimeoutMs = 3000;

        private int readTimeoutMs = 10000;
    }

    @Data
    public static class Pricing {
        private BigDecimal basePrice = new BigDecimal("0.99");
        private BigDecimal transcriptionPrice = new BigDecimal("0.25");
        private BigDecimal twoWayPrice = new BigDecimal("0.50");
        private BigDecimal sequencesPrice = new BigDecimal("0.50");

        /** Charged when recognition is on and the caller has called before. */
        private BigDecimal recognitionPrice = new BigDecimal("0.25");

        /** VIP priority: the first for a VIP caller, the second for anyone else. */
        private BigDecimal vipPrice = new BigDecimal("0.50");
        private BigDecimal vipPriorityPrice = new BigDecimal("0.25");
        private BigDecimal replyPrice = new BigDecimal("0.50");

        /** Calls are skipped entirely below this balance. */
        private BigDecimal minimumBalance = new BigDecimal("0.66");
    }

    @Data
    public static class Alerts {
        private List<BigDecimal> thresholds = new ArrayList<>(List.of(
                new BigDecimal("10.00"), new BigDecimal("5.00"), new BigDecimal("2.00")));
        private Duration cooldown = Duration.ofHours(24);
    }

    @Data
    public static class RateLimit {
        private int magicLinkPerEmail = 5;
        private int magicLinkPerIp = 10;
        private int adminLoginPerIp = 5;
        private Duration window = Duration.ofMinutes(15);
    }

    @Data
    public static class Admin {
        /** Hex SHA-256 of the admin password. Admin login is disabled while blank. */
        private String passwordHash;
        private Duration cookieMaxAge = Duration.ofHours(24);
    }

    @Data
    public static class Async {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 500;
    }
}
