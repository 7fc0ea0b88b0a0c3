package com.flagship.missed_call.webhook;

import com.flagship.missed_call.config.MissedCallProperties;
import com.flagship.missed_call.customer.Customer;
import com.flagship.missed_call.customer.CustomerService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Answers forwarded calls with TwiML: the business greeting, then a
 * recording whose completion posts to the call webhook.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class VoiceWebhookController {

    static final String RECORDING_CALLBACK_PATH = "/api/webhooks/twilio/call";
    static final int MAX_RECORDING_SECONDS = 120;
    static final int SILENCE_TIMEOUT_SECONDS = 5;

    private final TwilioSignatureValidator signatureValidator;
    private final CustomerService customerService;
    private final MissedCallProperties properties;

    @PostMapping(value = "/api/voice", produces = MediaType.TEXT_XML_VALUE)
    public ResponseEntity<String> answer(@RequestParam Map<String, String> params, HttpServletRequest request) {
        signatureValidator.validate(request, params);
        String callSid = WebhookParams.required(params, "CallSid");
        String calledNumber = WebhookParams.required(params, "To");

        Optional<Customer> customer = customerService.findServiceableByPhoneNumber(calledNumber);
        String twiml = customer
                .map(this::greetAndRecord)
                .orElseGet(() -> {
                    log.warn("Voice call {} to unknown or inactive number {}", callSid, calledNumber);
                    return new TwimlWriter()
                            .say("Sorry, the number you have called is not in service.")
                            .hangup()
                            .build();
                });

        return ResponseEntity.ok().contentType(MediaType.TEXT_XML).body(twiml);
    }

    private String greetAndRecord(Customer customer) {
        TwimlWriter twiml = new TwimlWriter();
        if (customer.getGreetingUrl() != null && !customer.getGreetingUrl().isBlank()) {
            twiml.play(customer.getGreetingUrl());
        } else {
            twiml.say("Hi, you've reached " + customer.getBusinessName()
                    + ". Please leave a message after the beep.");
        }
        return twiml
                .record(callbackUrl(), MAX_RECORDING_SECONDS, SILENCE_TIMEOUT_SECONDS)
                .build();
    }

    private String callbackUrl() {
        String base = properties.getPublicBaseUrl();
        return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + RECORDING_CALLBACK_PATH;
    }
}
