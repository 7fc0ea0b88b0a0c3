package com.flagship.missed_call.wallet;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Thrown when a debit would take a wallet below zero. Nothing was written.
 */
@Getter
public class InsufficientFundsException extends RuntimeException {

    private final UUID customerId;
    private final BigDecimal balance;
    private final BigDecimal requested;

    public InsufficientFundsException(UUID customerId, BigDecimal balance, BigDecimal requested) {
        super(String.format("Insufficient funds for customer %s: balance=%s, requested=%s",
                customerId, balance, requested));
        this.customerId = customerId;
        this.balance = balance;
        this.requested = requested;
    }
}
