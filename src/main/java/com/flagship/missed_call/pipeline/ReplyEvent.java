package com.flagship.missed_call.pipeline;

import lombok.Builder;
import lombok.Value;

/**
 * An inbound SMS from a caller answering one of our automated responses.
 */
@Value
@Builder
public class ReplyEvent {
    String messageSid;
    String fromNumber;
    String toNumber;
    String body;
}
