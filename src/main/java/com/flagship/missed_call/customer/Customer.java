package com.flagship.missed_call.customer;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A business using the service: the number its missed calls are forwarded
 * to, its opening hours and the paid features it has switched on.
 */
@Value
@Builder
public class Customer {
    UUID id;
    String email;
    String businessName;
    String phoneNumber;
    boolean verified;
    BusinessHours businessHours;
    String greetingUrl;
    String customMessage;
    boolean twoWayEnabled;
    boolean transcriptionEnabled;
    boolean sequencesEnabled;
    boolean recognitionEnabled;
    boolean vipPriorityEnabled;
    boolean active;
}
