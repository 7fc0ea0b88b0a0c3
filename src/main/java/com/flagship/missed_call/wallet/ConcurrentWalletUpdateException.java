package com.flagship.missed_call.wallet;

import java.util.UUID;

/**
 * Thrown when the optimistic retry loop could not apply a posting because
 * the wallet kept changing underneath it.
 */
public class ConcurrentWalletUpdateException extends RuntimeException {

    public ConcurrentWalletUpdateException(UUID customerId, int attempts) {
        super("Wallet " + customerId + " still contended after " + attempts + " attempts");
    }
}
