package com.flagship.missed_call.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Body of POST /api/admin/users. data carries action arguments, e.g.
 * {"amount": "20.00", "reference_id": "stripe-evt-1"} for wallet actions.
 */
@Value
public class AdminActionRequest {

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("action")
    String action;

    @JsonProperty("data")
    Map<String, Object> data;
}
