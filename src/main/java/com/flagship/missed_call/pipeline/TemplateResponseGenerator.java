package com.flagship.missed_call.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default generator: the customer's own message when set, otherwise a fixed
 * template per response type with the business name filled in. A named VIP
 * caller is greeted by name.
 */
@Component
@Slf4j
public class TemplateResponseGenerator implements ResponseGenerator {

    static final String STANDARD_TEMPLATE =
            "{greeting}, this is {businessName}! We just missed you. Reply here and skip the callback, "
            + "we're ready to help right now.";
    static final String VOICEMAIL_TEMPLATE =
            "{greeting}, this is {businessName}! Got your message and we're already on it. "
            + "Expect to hear from us very soon!";
    static final String AFTER_HOURS_TEMPLATE =
            "{greeting}, this is {businessName}! Sorry we missed your call, we're closed right now. "
            + "We're back during business hours ({businessHours}) and will get back to you first thing.";

    private static final int MAX_LENGTH = 1600;
    private static final String ANONYMOUS_CALLER = "there";

    @Override
    public String generate(ResponseRequest request) {
        String template = request.getCustomMessage() != null && !request.getCustomMessage().isBlank()
                ? request.getCustomMessage()
                : templateFor(request);

        boolean named = request.getCallerName() != null && !request.getCallerName().isBlank();
        String text = template
                .replace("{greeting}", named ? "Hi " + request.getCallerName().trim() : "Hi")
                .replace("{callerName}", named ? request.getCallerName().trim() : ANONYMOUS_CALLER)
                .replace("{businessName}", nullToEmpty(request.getBusinessName()))
                .replace("{businessHours}", nullToEmpty(request.getBusinessHours()))
                .trim();

        if (text.length() > MAX_LENGTH) {
            log.warn("Response for {} truncated from {} to {} chars",
                    request.getBusinessName(), text.length(), MAX_LENGTH);
            text = text.substring(0, MAX_LENGTH);
        }
        return text;
    }

    private static String templateFor(ResponseRequest request) {
        return switch (request.getResponseType()) {
            case VOICEMAIL -> VOICEMAIL_TEMPLATE;
            case AFTER_HOURS -> AFTER_HOURS_TEMPLATE;
            case STANDARD -> STANDARD_TEMPLATE;
        };
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
