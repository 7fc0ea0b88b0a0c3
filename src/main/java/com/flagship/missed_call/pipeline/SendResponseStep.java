package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.channel.DeliveryReceipt;
import com.flagship.missed_call.channel.MessageSender;
import com.flagship.missed_call.saga.SagaStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Step 2: send the SMS from the business number to the caller.
 *
 * Irreversible. If a later step fails the caller has still been texted; the
 * debit that follows is refunded instead, so the customer is not charged for it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SendResponseStep implements SagaStep<MissedCallContext> {

    static final String NAME = "send-response";

    private final MessageSender messageSender;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MissedCallContext execute(MissedCallContext context) {
        DeliveryReceipt receipt = messageSender.send(
                context.getEvent().getCalledNumber(),
                context.getEvent().getCallerNumber(),
                context.getResponseText());
        log.info("Response sent for {}: deliveryId={}, status={}",
                context.externalEventId(), receipt.getDeliveryId(), receipt.getStatus());
        return context.toBuilder().delivery(receipt).build();
    }

    @Override
    public void compensate(MissedCallContext context) {
        log.warn("Cannot unsend response {} for {}; caller {} keeps the message",
                context.getDelivery() != null ? context.getDelivery().getDeliveryId() : null,
                context.externalEventId(), context.getEvent().getCallerNumber());
    }

    @Override
    public boolean isIrreversible() {
        return true;
    }
}
