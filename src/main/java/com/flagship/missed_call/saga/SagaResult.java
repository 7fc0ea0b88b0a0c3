package com.flagship.missed_call.saga;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a {@link Saga} run.
 *
 * On failure, finalContext is the context produced by the last completed
 * step (or the initial context when the first step failed).
 */
@Value
@Builder
public class SagaResult<C> {
    String sagaName;
    boolean success;
    @Singular
    List<String> completedSteps;
    String failedStep;
    RuntimeException error;
    C finalContext;
    @Singular
    List<String> compensatedSteps;
    @Singular
    List<String> compensationFailures;

    /**
     * True when the saga failed with the given exception type (or one caused by it).
     */
    public boolean failedWith(Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    public boolean hasCompensationFailures() {
        return !compensationFailures.isEmpty();
    }
}
