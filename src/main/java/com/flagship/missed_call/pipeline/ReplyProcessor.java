package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.callrecord.CallRecord;
import com.flagship.missed_call.callrecord.CallRecordService;
import com.flagship.missed_call.customer.Customer;
import com.flagship.missed_call.customer.CustomerService;
import com.flagship.missed_call.observability.CorrelationContext;
import com.flagship.missed_call.observability.PipelineMetrics;
import com.flagship.missed_call.saga.Saga;
import com.flagship.missed_call.saga.SagaResult;
import com.flagship.missed_call.saga.SagaStep;
import com.flagship.missed_call.wallet.InsufficientFundsException;
import com.flagship.missed_call.wallet.LedgerPosting;
import com.flagship.missed_call.wallet.TransactionKind;
import com.flagship.missed_call.wallet.WalletLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Charges for a caller's SMS reply and attaches it to their latest call.
 *
 * Two steps: debit the reply price keyed by MessageSid, then mark the call
 * record replied. A record that was replied to in the meantime fails the
 * second step and the debit is refunded. Only the first reply to a call is
 * billed.
 */
@Service
@Slf4j
public class ReplyProcessor {

    static final String SAGA_NAME = "reply";

    private final CustomerService customerService;
    private final CallRecordService callRecordService;
    private final WalletLedgerService ledgerService;
    private final CallPricing pricing;
    private final ChargeRefunder refunder;
    private final PipelineMetrics metrics;
    private final Saga<ReplyContext> saga;

    public ReplyProcessor(CustomerService customerService,
                          CallRecordService callRecordService,
                          WalletLedgerService ledgerService,
                          CallPricing pricing,
                          ChargeRefunder refunder,
                          PipelineMetrics metrics) {
        this.customerService = customerService;
        this.callRecordService = callRecordService;
        this.ledgerService = ledgerService;
        this.pricing = pricing;
        this.refunder = refunder;
        this.metrics = metrics;
        this.saga = new Saga<>(SAGA_NAME, List.of(
                SagaStep.of("debit-reply", this::debitReply, this::refundReply),
                SagaStep.withoutCompensation("mark-replied", this::markReplied)
        ));
    }

    public ReplyOutcome process(ReplyEvent event) {
        long started = System.nanoTime();
        MDC.put(CorrelationContext.CALL_SID_MDC_KEY, event.getMessageSid());
        try {
            ReplyOutcome outcome = doProcess(event);
            metrics.recordPipelineOutcome(SAGA_NAME, outcome.name(), Duration.ofNanos(System.nanoTime() - started));
            return outcome;
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing reply {}", event.getMessageSid(), e);
            metrics.recordPipelineOutcome(SAGA_NAME, ReplyOutcome.FAILED.name(),
                    Duration.ofNanos(System.nanoTime() - started));
            return ReplyOutcome.FAILED;
        } finally {
            MDC.remove(CorrelationContext.CALL_SID_MDC_KEY);
            MDC.remove(CorrelationContext.CUSTOMER_ID_MDC_KEY);
        }
    }

    private ReplyOutcome doProcess(ReplyEvent event) {
        if (ledgerService.findPosting(event.getMessageSid(), TransactionKind.DEBIT).isPresent()) {
            log.info("Reply {} already charged, skipping", event.getMessageSid());
            metrics.incrementDuplicates();
            return ReplyOutcome.DUPLICATE;
        }

        Optional<Customer> found = customerService.findServiceableByPhoneNumber(event.getToNumber());
        if (found.isEmpty()) {
            log.warn("No active customer for number {}, ignoring reply {}", event.getToNumber(), event.getMessageSid());
            return ReplyOutcome.UNKNOWN_CUSTOMER;
        }
        Customer customer = found.get();
        MDC.put(CorrelationContext.CUSTOMER_ID_MDC_KEY, customer.getId().toString());

        if (!customer.isTwoWayEnabled()) {
            log.info("Two-way replies disabled for customer {}, ignoring reply {}", customer.getId(), event.getMessageSid());
            return ReplyOutcome.TWO_WAY_DISABLED;
        }

        Optional<CallRecord> record = callRecordService.findLatestUnreplied(customer.getId(), event.getFromNumber());
        if (record.isEmpty()) {
            log.info("No unreplied call from {} for customer {}, reply {} not billed",
                    event.getFromNumber(), customer.getId(), event.getMessageSid());
            return ReplyOutcome.NO_OPEN_CALL;
        }

        SagaResult<ReplyContext> result = saga.run(ReplyContext.builder()
                .event(event)
                .customer(customer)
                .record(record.get())
                .cost(pricing.replyPrice())
                .build());

        if (result.isSuccess()) {
            log.info("Reply {} recorded on call {}, charged {}", event.getMessageSid(),
                    record.get().getExternalEventId(), pricing.replyPrice());
            return ReplyOutcome.RECORDED;
        }
        if (result.failedWith(InsufficientFundsException.class)) {
            log.warn("Billing exception: reply {} not charged, insufficient funds for customer {}",
                    event.getMessageSid(), customer.getId());
            metrics.recordBillingException("reply_insufficient_funds");
            return ReplyOutcome.INSUFFICIENT_FUNDS;
        }
        log.error("Reply {} failed at step {}; compensated {}", event.getMessageSid(),
                result.getFailedStep(), result.getCompensatedSteps(), result.getError());
        return ReplyOutcome.FAILED;
    }

    private ReplyContext debitReply(ReplyContext context) {
        LedgerPosting debit = ledgerService.debit(
                context.getCustomer().getId(),
                context.getCost(),
                "Reply from " + context.getEvent().getFromNumber(),
                context.getEvent().getMessageSid());
        return context.toBuilder().debit(debit).build();
    }

    private void refundReply(ReplyContext context) {
        LedgerPosting debit = context.getDebit();
        if (debit == null || debit.isReplayed()) {
            return;
        }
        refunder.refund(debit, "Refund: reply from " + context.getEvent().getFromNumber());
    }

    private ReplyContext markReplied(ReplyContext context) {
        callRecordService.markReplied(context.getRecord().getId(), context.getEvent().getBody(), context.getCost());
        return context;
    }
}
