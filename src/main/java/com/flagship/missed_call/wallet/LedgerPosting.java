package com.flagship.missed_call.wallet;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Result of a debit or credit.
 *
 * replayed is true when the reference id had already been posted and the
 * call returned the original posting without touching the balance.
 */
@Value
public class LedgerPosting {
    UUID transactionId;
    UUID customerId;
    TransactionKind kind;
    BigDecimal amount;
    BigDecimal balanceAfter;
    String referenceId;
    boolean replayed;

    static LedgerPosting from(WalletTransaction transaction, boolean replayed) {
        return new LedgerPosting(
            transaction.getId(),
            transaction.getCustomerId(),
            transaction.getKind(),
            transaction.getAmount().abs(),
            transaction.getBalanceAfter(),
            transaction.getReferenceId(),
            replayed
        );
    }
}
