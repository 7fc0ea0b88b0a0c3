package com.flagship.missed_call.saga;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Generic saga orchestrator over an ordered list of steps.
 *
 * Execution rules:
 * 1. Steps run strictly in order, each receiving the previous step's context
 * 2. The first failing step stops forward execution
 * 3. Every completed step is compensated exactly once, in reverse order,
 *    with the context its own execute produced
 * 4. A failing compensation is logged and recorded; the rest still run
 *
 * A Saga holds no run state and can be reused across threads.
 *
 * @param <C> saga context type
 */
@Slf4j
public class Saga<C> {

    private final String name;
    private final List<SagaStep<C>> steps;

    public Saga(String name, List<SagaStep<C>> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Saga must have at least one step");
        }
        this.name = name;
        this.steps = List.copyOf(steps);
    }

    public String getName() {
        return name;
    }

    public List<SagaStep<C>> getSteps() {
        return steps;
    }

    public SagaResult<C> run(C initialContext) {
        SagaResult.SagaResultBuilder<C> result = SagaResult.<C>builder().sagaName(name);
        Deque<CompletedStep<C>> completed = new ArrayDeque<>();
        C context = initialContext;

        for (SagaStep<C> step : steps) {
            try {
                log.debug("Saga {}: executing step {}", name, step.name());
                C next = step.execute(context);
                if (next == null) {
                    throw new IllegalStateException("Step " + step.name() + " returned a null context");
                }
                completed.push(new CompletedStep<>(step, next));
                result.completedStep(step.name());
                context = next;
            } catch (RuntimeException e) {
                log.warn("Saga {}: step {} failed after {} completed step(s): {}",
                        name, step.name(), completed.size(), e.getMessage());
                compensate(completed, result);
                return result
                        .success(false)
                        .failedStep(step.name())
                        .error(e)
                        .finalContext(context)
                        .build();
            }
        }

        log.debug("Saga {}: all {} steps completed", name, steps.size());
        return result.success(true).finalContext(context).build();
    }

    private void compensate(Deque<CompletedStep<C>> completed, SagaResult.SagaResultBuilder<C> result) {
        while (!completed.isEmpty()) {
            CompletedStep<C> done = completed.pop();
            try {
                log.debug("Saga {}: compensating step {}", name, done.step.name());
                done.step.compensate(done.context);
                result.compensatedStep(done.step.name());
            } catch (RuntimeException e) {
                log.error("Saga {}: compensation of step {} failed", name, done.step.name(), e);
                result.compensationFailure(done.step.name());
            }
        }
    }

    private static final class CompletedStep<C> {
        private final SagaStep<C> step;
        private final C context;

        private CompletedStep(SagaStep<C> step, C context) {
            this.step = step;
            this.context = context;
        }
    }
}
