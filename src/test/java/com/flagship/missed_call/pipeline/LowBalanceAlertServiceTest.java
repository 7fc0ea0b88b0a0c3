package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.BaseIntegrationTest;
import com.flagship.missed_call.customer.Customer;
import com.flagship.missed_call.outbox.OutboxEventTypes;
import com.flagship.missed_call.outbox.OutboxService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cooldown bookkeeping: one alert per customer and threshold per 24 hours.
 */
class LowBalanceAlertServiceTest extends BaseIntegrationTest {

    private static final BigDecimal TEN = new BigDecimal("10.00");
    private static final BigDecimal FIVE = new BigDecimal("5.00");
    private static final BigDecimal TWO = new BigDecimal("2.00");

    @Autowired
    private LowBalanceAlertService alertService;

    @Autowired
    private OutboxService outboxService;

    private long alertCount(Customer customer) {
        return outboxService.getEventsForAggregate(OutboxEventTypes.CUSTOMER_AGGREGATE, customer.getId())
                .stream()
                .filter(event -> event.getEventType().equals(OutboxEventTypes.LOW_BALANCE_ALERT))
                .count();
    }

    @Test
    @DisplayName("Second claim inside the cooldown is refused, after it succeeds")
    void testCooldown() {
        printTestHeader("Cooldown window");

        // Given
        Customer customer = createCustomer("0");
        Instant now = Instant.now();

        // When
        boolean first = alertService.checkAndRecord(customer.getId(), TEN, now);
        boolean oneHourLater = alertService.checkAndRecord(customer.getId(), TEN, now.plus(Duration.ofHours(1)));
        boolean nextDay = alertService.checkAndRecord(customer.getId(), TEN, now.plus(Duration.ofHours(25)));
        printOutput("First", first);
        printOutput("+1h", oneHourLater);
        printOutput("+25h", nextDay);

        // Then
        assertTrue(first);
        assertFalse(oneHourLater);
        assertTrue(nextDay);
        printSuccess("Cooldown honored");
    }

    @Test
    @DisplayName("Each threshold has its own cooldown")
    void testThresholdsIndependent() {
        UUID customerId = createCustomer("0").getId();
        Instant now = Instant.now();

        assertTrue(alertService.checkAndRecord(customerId, TEN, now));
        assertTrue(alertService.checkAndRecord(customerId, FIVE, now));
        assertFalse(alertService.checkAndRecord(customerId, TEN, now.plusSeconds(60)));
        assertTrue(alertService.checkAndRecord(customerId, TWO, now.plusSeconds(60)));
        assertEquals(3, countRows("low_balance_alerts", "customer_id = ?", customerId));
    }

    @Test
    @DisplayName("Balance 4.00 fires 10.00 and 5.00, highest first, then nothing until the cooldown ends")
    void testCheckThresholds() {
        Customer customer = createCustomer("4.00");

        List<BigDecimal> first = alertService.checkThresholds(customer, new BigDecimal("4.00"));
        List<BigDecimal> again = alertService.checkThresholds(customer, new BigDecimal("3.50"));

        assertEquals(List.of(TEN, FIVE), first);
        assertTrue(again.isEmpty());
        assertEquals(2, alertCount(customer));
    }

    @Test
    @DisplayName("Balance exactly at a threshold counts as low")
    void testAtThreshold() {
        Customer customer = createCustomer("5.00");

        assertFalse(alertService.raiseIfDue(customer, new BigDecimal("5.01"), FIVE));
        assertTrue(alertService.raiseIfDue(customer, new BigDecimal("5.00"), FIVE));
    }

    @Test
    @DisplayName("Balance above every threshold raises nothing")
    void testHealthyBalance() {
        Customer customer = createCustomer("50.00");

        assertTrue(alertService.checkThresholds(customer, new BigDecimal("50.00")).isEmpty());
        assertEquals(0, alertCount(customer));
        assertEquals(0, countRows("low_balance_alerts", "customer_id = ?", customer.getId()));
    }

    @Test
    @DisplayName("Alert payload carries the customer contact and the amounts")
    void testAlertPayload() {
        Customer customer = createCustomer("1.50");

        alertService.raiseIfDue(customer, new BigDecimal("1.50"), TWO);

        String payload = outboxService.getEventsOfType(OutboxEventTypes.LOW_BALANCE_ALERT).stream()
                .filter(event -> event.getAggregateId().equals(customer.getId()))
                .findFirst()
                .orElseThrow()
                .getPayload();
        printOutput("Payload", payload);
        assertTrue(payload.contains(customer.getEmail()));
        assertTrue(payload.contains("\"businessName\":\"Acme Plumbing\""));
        assertTrue(payload.contains("\"balance\":1.50"));
        assertTrue(payload.contains("\"threshold\":2.00"));
    }
}
