package com.flagship.missed_call.admin.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdminActionResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("action")
    String action;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("replayed")
    Boolean replayed;

    @JsonProperty("active")
    Boolean active;
}
