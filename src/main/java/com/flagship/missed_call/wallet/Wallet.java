package com.flagship.missed_call.wallet;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A customer's prepaid balance. Read model only; mutations go through
 * {@link WalletLedgerService#debit} and {@link WalletLedgerService#credit}.
 */
@Value
public class Wallet {
    UUID customerId;
    BigDecimal balance;
    String currency;
    long version;
    Instant updatedAt;
}
