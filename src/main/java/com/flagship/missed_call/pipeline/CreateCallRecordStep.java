package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.callrecord.CallRecord;
import com.flagship.missed_call.callrecord.CallRecordService;
import com.flagship.missed_call.saga.SagaStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Step 4: persist the call record. The unique external event id makes a
 * concurrent duplicate fail here, after which its debit is compensated.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CreateCallRecordStep implements SagaStep<MissedCallContext> {

    static final String NAME = "create-record";

    private final CallRecordService callRecordService;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MissedCallContext execute(MissedCallContext context) {
        MissedCallEvent event = context.getEvent();
        CallRecord record = callRecordService.create(CallRecord.builder()
                .customerId(context.getCustomer().getId())
                .externalEventId(event.getExternalEventId())
                .callerNumber(event.getCallerNumber())
                .responseType(context.getResponseType())
                .responseText(context.getResponseText())
                .deliveryId(context.getDelivery().getDeliveryId())
                .deliveryStatus(context.getDelivery().getStatus())
                .voicemailUrl(event.getRecordingUrl())
                .transcript(event.getTranscriptionText())
                .cost(context.getDebit().getAmount())
                .build());
        return context.toBuilder().record(record).build();
    }

    @Override
    public void compensate(MissedCallContext context) {
        if (context.getRecord() != null) {
            callRecordService.delete(context.getRecord().getId());
        }
    }
}
