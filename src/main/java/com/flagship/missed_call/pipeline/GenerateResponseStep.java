package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.customer.Customer;
import com.flagship.missed_call.saga.SagaStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;

/**
 * Step 1: word the reply. Nothing to undo.
 */
@Component
@RequiredArgsConstructor
public class GenerateResponseStep implements SagaStep<MissedCallContext> {

    static final String NAME = "generate-response";

    private static final DateTimeFormatter HOURS_FORMAT = DateTimeFormatter.ofPattern("h:mm a");

    private final ResponseGenerator generator;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MissedCallContext execute(MissedCallContext context) {
        Customer customer = context.getCustomer();
        ResponseRequest request = ResponseRequest.builder()
                .businessName(customer.getBusinessName())
                .responseType(context.getResponseType())
                .customMessage(customer.getCustomMessage())
                .callerNumber(context.getEvent().getCallerNumber())
                .callerName(context.getCaller() != null ? context.getCaller().getVipName() : null)
                .transcript(context.getEvent().getTranscriptionText())
                .businessHours(describeHours(customer))
                .twoWayEnabled(customer.isTwoWayEnabled())
                .build();

        String text = generator.generate(request);
        if (text == null || text.isBlank()) {
            throw new IllegalStateException("Response generator returned no text for " + context.externalEventId());
        }
        return context.toBuilder().responseText(text).build();
    }

    @Override
    public void compensate(MissedCallContext context) {
        // pure computation
    }

    private static String describeHours(Customer customer) {
        if (customer.getBusinessHours() == null) {
            return "";
        }
        return HOURS_FORMAT.format(customer.getBusinessHours().getStart())
                + " - " + HOURS_FORMAT.format(customer.getBusinessHours().getEnd());
    }
}
