package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.saga.Saga;
import com.flagship.missed_call.saga.SagaResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The missed-call saga: generate, send, debit, record, low-balance check.
 *
 * Send comes before debit. A failed send leaves the wallet untouched; a
 * failed debit after a send is a billing exception the processor reports.
 */
@Component
public class MissedCallPipeline {

    static final String SAGA_NAME = "missed-call";

    private final Saga<MissedCallContext> saga;

    public MissedCallPipeline(GenerateResponseStep generateResponse,
                              SendResponseStep sendResponse,
                              DebitWalletStep debitWallet,
                              CreateCallRecordStep createRecord,
                              LowBalanceCheckStep lowBalanceCheck) {
        this.saga = new Saga<>(SAGA_NAME, List.of(
                generateResponse,
                sendResponse,
                debitWallet,
                createRecord,
                lowBalanceCheck
        ));
    }

    public SagaResult<MissedCallContext> run(MissedCallContext context) {
        return saga.run(context);
    }

    public List<String> stepNames() {
        return saga.getSteps().stream().map(step -> step.name()).toList();
    }
}
