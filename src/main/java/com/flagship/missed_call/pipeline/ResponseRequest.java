package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.callrecord.ResponseType;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a {@link ResponseGenerator} may use to word the reply.
 */
@Value
@Builder
public class ResponseRequest {
    String businessName;
    ResponseType responseType;
    String customMessage;
    String callerNumber;
    /** Set for a named VIP caller. */
    String callerName;
    String transcript;
    String businessHours;
    boolean twoWayEnabled;
}
