package com.flagship.missed_call.wallet;

import java.util.UUID;

public class WalletNotFoundException extends RuntimeException {

    public WalletNotFoundException(UUID customerId) {
        super("Wallet not found for customer: " + customerId);
    }
}
