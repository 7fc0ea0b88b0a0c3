package com.flagship.missed_call.wallet;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable wallet transaction log row.
 *
 * amount is the signed delta applied to the balance; balanceAfter is the
 * balance snapshot right after this row was applied.
 */
@Value
public class WalletTransaction {
    UUID id;
    UUID customerId;
    BigDecimal amount;
    TransactionKind kind;
    String description;
    String referenceId;
    BigDecimal balanceAfter;
    Instant createdAt;
    long sequenceNumber;
}
