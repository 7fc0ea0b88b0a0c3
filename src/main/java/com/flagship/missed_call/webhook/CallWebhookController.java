package com.flagship.missed_call.webhook;

import com.flagship.missed_call.pipeline.MissedCallEvent;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Missed-call event from the provider. Acknowledged with "OK" as soon as the
 * signature and fields check out; the pipeline runs in the background and
 * its outcome never reaches the provider.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class CallWebhookController {

    private final TwilioSignatureValidator signatureValidator;
    private final WebhookDispatcher dispatcher;

    @PostMapping(value = "/api/webhooks/twilio/call", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> missedCall(@RequestParam Map<String, String> params, HttpServletRequest request) {
        signatureValidator.validate(request, params);

        MissedCallEvent event = MissedCallEvent.builder()
                .externalEventId(WebhookParams.required(params, "CallSid"))
                .callerNumber(WebhookParams.required(params, "From"))
                .calledNumber(WebhookParams.required(params, "To"))
                .recordingUrl(WebhookParams.optional(params, "RecordingUrl"))
                .transcriptionText(WebhookParams.optional(params, "TranscriptionText"))
                .receivedAt(Instant.now())
                .build();

        log.info("Missed call {} from {} to {} accepted", event.getExternalEventId(),
                event.getCallerNumber(), event.getCalledNumber());
        dispatcher.dispatchMissedCall(event);
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body("OK");
    }
}
