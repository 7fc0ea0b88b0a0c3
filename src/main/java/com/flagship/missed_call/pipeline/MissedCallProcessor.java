package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.callrecord.CallRecordService;
import com.flagship.missed_call.callrecord.DuplicateCallRecordException;
import com.flagship.missed_call.callrecord.ResponseType;
import com.flagship.missed_call.channel.MessageDeliveryException;
import com.flagship.missed_call.customer.Customer;
import com.flagship.missed_call.customer.CustomerService;
import com.flagship.missed_call.customer.VipContact;
import com.flagship.missed_call.observability.CorrelationContext;
import com.flagship.missed_call.observability.PipelineMetrics;
import com.flagship.missed_call.saga.SagaResult;
import com.flagship.missed_call.wallet.InsufficientFundsException;
import com.flagship.missed_call.wallet.WalletLedgerService;
import com.flagship.missed_call.webhook.IdempotencyGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one missed-call event end to end, after the webhook has been acknowledged.
 *
 * Order: duplicate check, customer lookup, charge reference, minimum-balance
 * gate, caller lookup, classification and pricing, then the saga. Never
 * throws; every exit is logged and reported as a {@link MissedCallOutcome}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MissedCallProcessor {

    private final IdempotencyGuard idempotencyGuard;
    private final CustomerService customerService;
    private final CallRecordService callRecordService;
    private final WalletLedgerService ledgerService;
    private final EventClassifier classifier;
    private final CallPricing pricing;
    private final ChargeRefunder refunder;
    private final MissedCallPipeline pipeline;
    private final LowBalanceAlertService alertService;
    private final PipelineMetrics metrics;

    public MissedCallOutcome process(MissedCallEvent event) {
        long started = System.nanoTime();
        MDC.put(CorrelationContext.CALL_SID_MDC_KEY, event.getExternalEventId());
        try {
            MissedCallOutcome outcome = doProcess(event);
            metrics.recordPipelineOutcome(MissedCallPipeline.SAGA_NAME, outcome.name(),
                    Duration.ofNanos(System.nanoTime() - started));
            return outcome;
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing missed call {}", event.getExternalEventId(), e);
            metrics.recordPipelineOutcome(MissedCallPipeline.SAGA_NAME, MissedCallOutcome.FAILED.name(),
                    Duration.ofNanos(System.nanoTime() - started));
            return MissedCallOutcome.FAILED;
        } finally {
            MDC.remove(CorrelationContext.CALL_SID_MDC_KEY);
            MDC.remove(CorrelationContext.CUSTOMER_ID_MDC_KEY);
        }
    }

    private MissedCallOutcome doProcess(MissedCallEvent event) {
        Optional<UUID> processed = idempotencyGuard.findProcessed(event.getExternalEventId());
        if (processed.isPresent()) {
            log.info("Duplicate missed call {} already recorded as {}, skipping",
                    event.getExternalEventId(), processed.get());
            metrics.incrementDuplicates();
            return MissedCallOutcome.DUPLICATE;
        }

        Optional<Customer> found = customerService.findServiceableByPhoneNumber(event.getCalledNumber());
        if (found.isEmpty()) {
            log.warn("No active customer for called number {}, ignoring call {}",
                    event.getCalledNumber(), event.getExternalEventId());
            return MissedCallOutcome.UNKNOWN_CUSTOMER;
        }
        Customer customer = found.get();
        MDC.put(CorrelationContext.CUSTOMER_ID_MDC_KEY, customer.getId().toString());

        Optional<String> chargeReference = refunder.nextChargeReference(event.getExternalEventId());
        if (chargeReference.isEmpty()) {
            log.error("Missed call {} was charged and refunded {} times, giving up",
                    event.getExternalEventId(), ChargeRefunder.MAX_CHARGE_ATTEMPTS);
            return MissedCallOutcome.FAILED;
        }
        if (!chargeReference.get().equals(event.getExternalEventId())) {
            log.info("Earlier charge for {} was refunded, charging this delivery as {}",
                    event.getExternalEventId(), chargeReference.get());
        }

        BigDecimal balance = ledgerService.getBalance(customer.getId());
        BigDecimal minimum = pricing.minimumBalance();
        if (balance.compareTo(minimum) < 0) {
            log.warn("Balance {} below minimum {} for customer {}, skipping call {}",
                    balance, minimum, customer.getId(), event.getExternalEventId());
            raiseAlertQuietly(customer, balance, minimum);
            return MissedCallOutcome.BELOW_MINIMUM_BALANCE;
        }

        Instant at = event.getReceivedAt() != null ? event.getReceivedAt() : Instant.now();
        CallerProfile caller = lookUpCaller(customer, event);
        ResponseType type = classifier.classify(customer, event, at);
        BigDecimal cost = pricing.priceFor(customer, event, caller);

        MissedCallContext initial = MissedCallContext.builder()
                .event(event)
                .customer(customer)
                .caller(caller)
                .responseType(type)
                .cost(cost)
                .chargeReference(chargeReference.get())
                .build();

        SagaResult<MissedCallContext> result = pipeline.run(initial);
        return handleResult(result, customer, balance, cost);
    }

    private MissedCallOutcome handleResult(SagaResult<MissedCallContext> result, Customer customer,
                                           BigDecimal balanceBefore, BigDecimal cost) {
        MissedCallContext context = result.getFinalContext();
        String externalEventId = context.externalEventId();

        if (result.isSuccess()) {
            idempotencyGuard.markProcessed(externalEventId, context.getRecord().getId());
            log.info("Missed call {} processed: type={}, cost={}, balanceAfter={}, record={}, alerts={}",
                    externalEventId, context.getResponseType(), cost,
                    context.getDebit().getBalanceAfter(), context.getRecord().getId(), context.getAlertsRaised());
            return MissedCallOutcome.PROCESSED;
        }

        if (result.failedWith(DuplicateCallRecordException.class)) {
            log.info("Missed call {} was recorded by a concurrent delivery; compensated {}",
                    externalEventId, result.getCompensatedSteps());
            metrics.incrementDuplicates();
            return MissedCallOutcome.DUPLICATE;
        }

        if (result.hasCompensationFailures()) {
            log.error("Compensation failed for {}: {}", externalEventId, result.getCompensationFailures());
        }

        if (result.failedWith(InsufficientFundsException.class)) {
            log.warn("Billing exception: response sent without charge for {} (customer={}, balance={}, cost={})",
                    externalEventId, customer.getId(), balanceBefore, cost);
            metrics.recordBillingException("insufficient_funds");
            raiseAlertQuietly(customer, ledgerService.getBalance(customer.getId()), cost);
            return MissedCallOutcome.INSUFFICIENT_FUNDS;
        }

        if (result.failedWith(MessageDeliveryException.class)) {
            log.warn("Response for {} could not be sent, nothing charged: {}",
                    externalEventId, result.getError().getMessage());
            return MissedCallOutcome.SEND_FAILED;
        }

        log.error("Missed call {} failed at step {} after {}; compensated {}",
                externalEventId, result.getFailedStep(), result.getCompletedSteps(),
                result.getCompensatedSteps(), result.getError());
        return MissedCallOutcome.FAILED;
    }

    private CallerProfile lookUpCaller(Customer customer, MissedCallEvent event) {
        Optional<VipContact> vip = customerService.findVipContact(customer.getId(), event.getCallerNumber());
        return CallerProfile.builder()
                .vip(vip.isPresent())
                .vipName(vip.map(VipContact::getName).orElse(null))
                .repeatCaller(callRecordService.hasPreviousCall(customer.getId(), event.getCallerNumber()))
                .build();
    }

    private void raiseAlertQuietly(Customer customer, BigDecimal balance, BigDecimal level) {
        try {
            alertService.raiseIfDue(customer, balance, level);
        } catch (RuntimeException e) {
            log.warn("Could not raise low balance alert for customer {}: {}", customer.getId(), e.getMessage());
        }
    }
}
