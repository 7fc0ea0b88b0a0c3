package com.flagship.missed_call.wallet;

/**
 * Kind of a wallet transaction.
 * DEBIT rows carry a negative amount, CREDIT rows a positive one.
 */
public enum TransactionKind {
    DEBIT,
    CREDIT
}
