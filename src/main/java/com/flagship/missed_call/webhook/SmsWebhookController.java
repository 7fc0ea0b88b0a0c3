package com.flagship.missed_call.webhook;

import com.flagship.missed_call.pipeline.ReplyEvent;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Inbound SMS replies from callers, billed by the reply pipeline.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class SmsWebhookController {

    private final TwilioSignatureValidator signatureValidator;
    private final WebhookDispatcher dispatcher;

    @PostMapping(value = "/api/webhooks/twilio/sms", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> reply(@RequestParam Map<String, String> params, HttpServletRequest request) {
        signatureValidator.validate(request, params);

        ReplyEvent event = ReplyEvent.builder()
                .messageSid(WebhookParams.required(params, "MessageSid"))
                .fromNumber(WebhookParams.required(params, "From"))
                .toNumber(WebhookParams.required(params, "To"))
                .body(params.get("Body"))
                .build();

        log.info("SMS reply {} from {} accepted", event.getMessageSid(), event.getFromNumber());
        dispatcher.dispatchReply(event);
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body("OK");
    }
}
