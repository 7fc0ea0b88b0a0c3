package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.customer.Customer;

import java.math.BigDecimal;

/**
 * Tells the customer their balance crossed an alert threshold. Called only
 * after the cooldown check passed.
 */
public interface LowBalanceNotifier {

    void notifyLowBalance(Customer customer, BigDecimal balance, BigDecimal threshold);
}
