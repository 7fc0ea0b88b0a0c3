package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.saga.SagaStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Step 5: alert on low balance. Never fails the saga; the charge and record
 * are already in place and an alert problem must not undo them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LowBalanceCheckStep implements SagaStep<MissedCallContext> {

    static final String NAME = "low-balance-check";

    private final LowBalanceAlertService alertService;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MissedCallContext execute(MissedCallContext context) {
        try {
            List<BigDecimal> raised = alertService.checkThresholds(
                    context.getCustomer(), context.getDebit().getBalanceAfter());
            if (raised.isEmpty()) {
                return context;
            }
            return context.toBuilder().alertsRaised(raised).build();
        } catch (RuntimeException e) {
            log.warn("Low balance check failed for customer {}: {}", context.getCustomer().getId(), e.getMessage(), e);
            return context;
        }
    }

    @Override
    public void compensate(MissedCallContext context) {
        // last step, never compensated
    }
}
