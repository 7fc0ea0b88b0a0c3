package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.callrecord.CallRecordService;
import com.flagship.missed_call.saga.SagaStep;
import com.flagship.missed_call.wallet.LedgerPosting;
import com.flagship.missed_call.wallet.WalletLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Step 3: charge the wallet, keyed by the context's charge reference.
 *
 * Compensation refunds only a debit this run applied. A replayed debit
 * belongs to the run that made it, and a debit whose call record exists is
 * backed by that record; both are left alone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DebitWalletStep implements SagaStep<MissedCallContext> {

    static final String NAME = "debit-wallet";

    private final WalletLedgerService ledgerService;
    private final CallRecordService callRecordService;
    private final ChargeRefunder refunder;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MissedCallContext execute(MissedCallContext context) {
        LedgerPosting posting = ledgerService.debit(
                context.getCustomer().getId(),
                context.getCost(),
                "Missed call from " + context.getEvent().getCallerNumber(),
                context.chargeReference());
        if (posting.isReplayed()) {
            log.info("Debit {} already applied, balance {}", context.chargeReference(), posting.getBalanceAfter());
        }
        return context.toBuilder().debit(posting).build();
    }

    @Override
    public void compensate(MissedCallContext context) {
        LedgerPosting debit = context.getDebit();
        if (debit == null) {
            return;
        }
        if (debit.isReplayed()) {
            log.info("Debit for {} was a replay, not refunding", context.externalEventId());
            return;
        }
        if (callRecordService.existsByExternalEventId(context.externalEventId())) {
            log.warn("Call record for {} exists, keeping the charge", context.externalEventId());
            return;
        }
        refunder.refund(debit, "Refund: missed call from " + context.getEvent().getCallerNumber());
    }
}
