package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.callrecord.ResponseType;
import com.flagship.missed_call.customer.BusinessHours;
import com.flagship.missed_call.customer.Customer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EventClassifierTest {

    private final EventClassifier classifier = new EventClassifier();

    private final Customer nineToFive = Customer.builder()
            .businessName("Acme")
            .businessHours(BusinessHours.parse("UTC", "09:00", "17:00", "1,2,3,4,5"))
            .build();

    private static final Instant MONDAY_NOON = Instant.parse("2024-01-01T12:00:00Z");
    private static final Instant MONDAY_NIGHT = Instant.parse("2024-01-01T22:00:00Z");

    private static MissedCallEvent call(String recordingUrl) {
        return MissedCallEvent.builder()
                .externalEventId("CA1")
                .callerNumber("+15550001111")
                .calledNumber("+15559998888")
                .recordingUrl(recordingUrl)
                .build();
    }

    @Test
    @DisplayName("Hang-up during business hours is STANDARD")
    void testStandard() {
        assertEquals(ResponseType.STANDARD, classifier.classify(nineToFive, call(null), MONDAY_NOON));
    }

    @Test
    @DisplayName("Recording during business hours is VOICEMAIL")
    void testVoicemail() {
        assertEquals(ResponseType.VOICEMAIL,
                classifier.classify(nineToFive, call("https://api.twilio.com/rec/RE1"), MONDAY_NOON));
    }

    @Test
    @DisplayName("After hours wins over voicemail")
    void testAfterHoursWins() {
        assertEquals(ResponseType.AFTER_HOURS, classifier.classify(nineToFive, call(null), MONDAY_NIGHT));
        assertEquals(ResponseType.AFTER_HOURS,
                classifier.classify(nineToFive, call("https://api.twilio.com/rec/RE1"), MONDAY_NIGHT));
    }

    @Test
    @DisplayName("Blank recording URL counts as no recording")
    void testBlankRecording() {
        assertEquals(ResponseType.STANDARD, classifier.classify(nineToFive, call("  "), MONDAY_NOON));
    }
}
