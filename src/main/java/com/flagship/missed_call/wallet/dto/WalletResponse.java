package com.flagship.missed_call.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.missed_call.wallet.Wallet;
import com.flagship.missed_call.wallet.WalletTransaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Wallet balance plus a page of its most recent transactions.
 */
@Value
@Builder
public class WalletResponse {

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("transactions")
    List<WalletTransactionResponse> transactions;

    public static WalletResponse from(Wallet wallet, List<WalletTransaction> transactions) {
        return WalletResponse.builder()
            .customerId(wallet.getCustomerId())
            .balance(wallet.getBalance())
            .currency(wallet.getCurrency())
            .transactions(transactions.stream().map(WalletTransactionResponse::from).toList())
            .build();
    }
}
