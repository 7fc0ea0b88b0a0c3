package com.flagship.missed_call.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.missed_call.wallet.TransactionKind;
import com.flagship.missed_call.wallet.WalletTransaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class WalletTransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("description")
    String description;

    @JsonProperty("reference_id")
    String referenceId;

    @JsonProperty("balance_after")
    BigDecimal balanceAfter;

    @JsonProperty("created_at")
    Instant createdAt;

    public static WalletTransactionResponse from(WalletTransaction transaction) {
        return WalletTransactionResponse.builder()
            .id(transaction.getId())
            .amount(transaction.getAmount())
            .kind(transaction.getKind())
            .description(transaction.getDescription())
            .referenceId(transaction.getReferenceId())
            .balanceAfter(transaction.getBalanceAfter())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
