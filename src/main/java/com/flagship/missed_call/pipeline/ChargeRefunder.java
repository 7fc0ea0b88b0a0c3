package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.wallet.LedgerPosting;
import com.flagship.missed_call.wallet.TransactionKind;
import com.flagship.missed_call.wallet.WalletLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reverses a debit made earlier in the same saga run.
 *
 * The refund credit is keyed "refund:" + the debit's reference, so running it
 * twice credits once. A failing refund is escalated and rethrown, which makes
 * the saga record a compensation failure.
 *
 * A refunded reference is spent: replaying its debit would report a charge
 * the refund already took back. {@link #nextChargeReference} picks the first
 * attempt reference (id, id#2, id#3, ...) that has no refund.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChargeRefunder {

    static final String REFUND_PREFIX = "refund:";
    static final String ATTEMPT_SEPARATOR = "#";
    static final int MAX_CHARGE_ATTEMPTS = 10;

    private final WalletLedgerService ledgerService;
    private final ReconciliationEscalator escalator;

    public LedgerPosting refund(LedgerPosting debit, String description) {
        String refundReference = refundReference(debit.getReferenceId());
        try {
            LedgerPosting refund = ledgerService.credit(debit.getCustomerId(), debit.getAmount(),
                    description, refundReference);
            log.info("Refunded {} to customer {} (ref={}), balance now {}",
                    debit.getAmount(), debit.getCustomerId(), refundReference, refund.getBalanceAfter());
            return refund;
        } catch (RuntimeException e) {
            escalator.escalate(debit.getCustomerId(), debit.getReferenceId(), debit.getAmount(),
                    "refund failed", e);
            throw e;
        }
    }

    /**
     * @return the reference to charge this event under, or empty once every
     *         attempt up to {@value #MAX_CHARGE_ATTEMPTS} has been refunded
     */
    public Optional<String> nextChargeReference(String externalEventId) {
        for (int attempt = 1; attempt <= MAX_CHARGE_ATTEMPTS; attempt++) {
            String reference = attemptReference(externalEventId, attempt);
            if (ledgerService.findPosting(refundReference(reference), TransactionKind.CREDIT).isEmpty()) {
                return Optional.of(reference);
            }
        }
        return Optional.empty();
    }

    static String attemptReference(String externalEventId, int attempt) {
        return attempt == 1 ? externalEventId : externalEventId + ATTEMPT_SEPARATOR + attempt;
    }

    public static String refundReference(String referenceId) {
        return REFUND_PREFIX + referenceId;
    }
}
