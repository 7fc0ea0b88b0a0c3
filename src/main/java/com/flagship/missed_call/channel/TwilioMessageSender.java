package com.flagship.missed_call.channel;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.missed_call.config.MissedCallProperties;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Sends SMS through the Twilio Messages REST resource.
 *
 * No retries here: a send whose response was lost may still have gone out,
 * and sending twice is worse than failing the step.
 */
@Component
@Slf4j
public class TwilioMessageSender implements MessageSender {

    private static final String MESSAGES_PATH = "/2010-04-01/Accounts/{accountSid}/Messages.json";

    private final WebClient webClient;
    private final MissedCallProperties properties;

    public TwilioMessageSender(@Qualifier("twilioWebClient") WebClient webClient,
                               MissedCallProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public DeliveryReceipt send(String from, String to, String body) {
        MissedCallProperties.Twilio twilio = properties.getTwilio();
        if (twilio.getAccountSid() == null || twilio.getAccountSid().isBlank()) {
            throw new MessageDeliveryException("Twilio account SID is not configured");
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("From", from);
        form.add("To", to);
        form.add("Body", body);

        log.debug("Sending SMS from {} to {} ({} chars)", from, to, body.length());
        try {
            TwilioMessageResponse response = webClient.post()
                    .uri(MESSAGES_PATH, twilio.getAccountSid())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData(form))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, res ->
                            res.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(error -> new MessageDeliveryException(
                                            "Twilio rejected message (" + res.statusCode().value() + "): " + error,
                                            res.statusCode().value())))
                    .bodyToMono(TwilioMessageResponse.class)
                    .timeout(Duration.ofMillis(twilio.getReadTimeoutMs()))
                    .block();

            if (response == null || response.getSid() == null) {
                throw new MessageDeliveryException("Twilio returned an empty message response");
            }
            log.info("SMS accepted by Twilio: sid={}, status={}", response.getSid(), response.getStatus());
            return new DeliveryReceipt(response.getSid(), response.getStatus());

        } catch (MessageDeliveryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MessageDeliveryException("SMS send failed: " + e.getMessage(), e);
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TwilioMessageResponse {
        @JsonProperty("sid")
        private String sid;

        @JsonProperty("status")
        private String status;

        @JsonProperty("error_code")
        private Integer errorCode;

        @JsonProperty("error_message")
        private String errorMessage;
    }
}
