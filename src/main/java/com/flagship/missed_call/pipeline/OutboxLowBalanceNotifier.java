package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.customer.Customer;
import com.flagship.missed_call.outbox.OutboxEventTypes;
import com.flagship.missed_call.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Publishes low-balance alerts as outbox events; the mailer consumes them
 * from the billing-alerts topic.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxLowBalanceNotifier implements LowBalanceNotifier {

    private final OutboxService outboxService;

    @Override
    @Transactional
    public void notifyLowBalance(Customer customer, BigDecimal balance, BigDecimal threshold) {
        outboxService.saveEvent(
                OutboxEventTypes.CUSTOMER_AGGREGATE,
                customer.getId(),
                OutboxEventTypes.LOW_BALANCE_ALERT,
                new LowBalanceAlert(customer.getId(), customer.getEmail(), customer.getBusinessName(),
                        balance, threshold, Instant.now()));
        log.info("Low balance alert queued for customer {}: balance={}, threshold={}",
                customer.getId(), balance, threshold);
    }

    @Value
    static class LowBalanceAlert {
        UUID customerId;
        String email;
        String businessName;
        BigDecimal balance;
        BigDecimal threshold;
        Instant raisedAt;
    }
}
