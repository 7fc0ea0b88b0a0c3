package com.flagship.missed_call.pipeline;

import lombok.Builder;
import lombok.Value;

/**
 * What the customer already knows about the caller: a VIP entry (with the
 * name to greet them by) and whether they have called before.
 */
@Value
@Builder
public class CallerProfile {
    boolean vip;
    String vipName;
    boolean repeatCaller;

    public static CallerProfile unknown() {
        return CallerProfile.builder().build();
    }
}
