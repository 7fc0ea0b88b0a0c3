package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.callrecord.ResponseType;
import com.flagship.missed_call.customer.BusinessHours;
import com.flagship.missed_call.customer.Customer;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Picks the response type for a missed call. After-hours wins over
 * voicemail, voicemail over a plain hang-up.
 */
@Component
public class EventClassifier {

    public ResponseType classify(Customer customer, MissedCallEvent event, Instant at) {
        BusinessHours hours = customer.getBusinessHours();
        if (hours != null && !hours.isOpenAt(at)) {
            return ResponseType.AFTER_HOURS;
        }
        if (event.hasRecording()) {
            return ResponseType.VOICEMAIL;
        }
        return ResponseType.STANDARD;
    }
}
