package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.config.MissedCallProperties;
import com.flagship.missed_call.customer.Customer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Base 0.99 plus add-ons: sequences +0.50, recognition +0.25 (repeat caller),
 * two-way +0.50, VIP priority +0.50 / +0.25, transcription +0.25 (recording).
 */
class CallPricingTest {

    private static final MissedCallEvent HANG_UP = MissedCallEvent.builder()
            .externalEventId("CA1")
            .build();
    private static final MissedCallEvent VOICEMAIL = MissedCallEvent.builder()
            .externalEventId("CA2")
            .recordingUrl("https://api.twilio.com/recordings/RE1")
            .build();
    private static final CallerProfile NEW_CALLER = CallerProfile.unknown();

    private final CallPricing pricing = new CallPricing(new MissedCallProperties());

    private static Customer customer(boolean transcription, boolean twoWay) {
        return Customer.builder()
                .transcriptionEnabled(transcription)
                .twoWayEnabled(twoWay)
                .build();
    }

    @Test
    @DisplayName("Plain call costs the base price")
    void testBasePrice() {
        assertEquals(new BigDecimal("0.99"), pricing.priceFor(customer(false, false), HANG_UP, NEW_CALLER));
        assertEquals(new BigDecimal("0.99"), pricing.priceFor(customer(false, false), VOICEMAIL, NEW_CALLER));
    }

    @Test
    @DisplayName("Transcription is charged whenever a recording was left")
    void testTranscription() {
        assertEquals(new BigDecimal("1.24"), pricing.priceFor(customer(true, false), VOICEMAIL, NEW_CALLER));
        assertEquals(new BigDecimal("0.99"), pricing.priceFor(customer(true, false), HANG_UP, NEW_CALLER));
    }

    @Test
    @DisplayName("After-hours voicemail with transcription still pays for transcription")
    void testAfterHoursVoicemailTranscription() {
        // Classification plays no part: the recording alone decides
        MissedCallEvent afterHoursVoicemail = MissedCallEvent.builder()
                .externalEventId("CA3")
                .recordingUrl("https://api.twilio.com/recordings/RE3")
                .transcriptionText("Calling about the quote")
                .build();

        assertEquals(new BigDecimal("1.24"), pricing.priceFor(customer(true, false), afterHoursVoicemail, NEW_CALLER));
    }

    @Test
    @DisplayName("Two-way is charged on every call")
    void testTwoWay() {
        assertEquals(new BigDecimal("1.49"), pricing.priceFor(customer(false, true), HANG_UP, NEW_CALLER));
        assertEquals(new BigDecimal("1.74"), pricing.priceFor(customer(true, true), VOICEMAIL, NEW_CALLER));
    }

    @Test
    @DisplayName("Sequences add 0.50 to every call")
    void testSequences() {
        Customer customer = Customer.builder().sequencesEnabled(true).build();

        assertEquals(new BigDecimal("1.49"), pricing.priceFor(customer, HANG_UP, NEW_CALLER));
    }

    @Test
    @DisplayName("Recognition is charged only for a repeat caller")
    void testRecognition() {
        Customer customer = Customer.builder().recognitionEnabled(true).build();
        CallerProfile repeat = CallerProfile.builder().repeatCaller(true).build();

        assertEquals(new BigDecimal("0.99"), pricing.priceFor(customer, HANG_UP, NEW_CALLER));
        assertEquals(new BigDecimal("1.24"), pricing.priceFor(customer, HANG_UP, repeat));
        assertEquals(new BigDecimal("0.99"), pricing.priceFor(customer(false, false), HANG_UP, repeat));
    }

    @Test
    @DisplayName("VIP priority costs 0.50 for a VIP caller and 0.25 for anyone else")
    void testVipPriority() {
        Customer customer = Customer.builder().vipPriorityEnabled(true).build();
        CallerProfile vip = CallerProfile.builder().vip(true).vipName("Dana").build();

        assertEquals(new BigDecimal("1.49"), pricing.priceFor(customer, HANG_UP, vip));
        assertEquals(new BigDecimal("1.24"), pricing.priceFor(customer, HANG_UP, NEW_CALLER));
        assertEquals(new BigDecimal("0.99"), pricing.priceFor(customer(false, false), HANG_UP, vip));
    }

    @Test
    @DisplayName("Every add-on at once")
    void testAllAddOns() {
        Customer customer = Customer.builder()
                .sequencesEnabled(true)
                .recognitionEnabled(true)
                .twoWayEnabled(true)
                .vipPriorityEnabled(true)
                .transcriptionEnabled(true)
                .build();
        CallerProfile repeatVip = CallerProfile.builder().vip(true).repeatCaller(true).build();

        // 0.99 + 0.50 + 0.25 + 0.50 + 0.50 + 0.25
        assertEquals(new BigDecimal("2.99"), pricing.priceFor(customer, VOICEMAIL, repeatVip));
    }

    @Test
    @DisplayName("Reply price and minimum balance come from configuration")
    void testConfiguredAmounts() {
        MissedCallProperties properties = new MissedCallProperties();
        properties.getPricing().setReplyPrice(new BigDecimal("0.3"));
        properties.getPricing().setMinimumBalance(new BigDecimal("1"));
        CallPricing custom = new CallPricing(properties);

        assertEquals(new BigDecimal("0.30"), custom.replyPrice());
        assertEquals(new BigDecimal("1.00"), custom.minimumBalance());
        assertEquals(new BigDecimal("0.66"), pricing.minimumBalance());
    }
}
