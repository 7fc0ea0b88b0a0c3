package com.flagship.missed_call.customer;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A caller the customer wants recognized by name.
 */
@Value
@Builder
public class VipContact {
    UUID id;
    UUID customerId;
    String phoneNumber;
    String name;
}
