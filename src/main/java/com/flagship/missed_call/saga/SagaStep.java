package com.flagship.missed_call.saga;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * One step of a {@link Saga}: a forward action plus the action that
 * semantically undoes it.
 *
 * Contract:
 * - execute returns the context for the next step (never null) or throws
 * - compensate is best effort; anything it throws is caught and logged by the
 *   orchestrator and never stops the remaining compensations
 *
 * Irreversible steps (an SMS cannot be unsent) are built with
 * {@link #irreversible(String, UnaryOperator)}. Their compensation is an
 * explicit no-op, so the step author owns the risk window it leaves open.
 *
 * @param <C> saga context type
 */
public interface SagaStep<C> {

    String name();

    C execute(C context);

    void compensate(C context);

    /**
     * True when compensation cannot undo the effect of execute.
     * Informational only; the orchestrator treats every step the same.
     */
    default boolean isIrreversible() {
        return false;
    }

    static <C> SagaStep<C> of(String name, UnaryOperator<C> execute, Consumer<C> compensate) {
        return new FunctionalStep<>(name, execute, compensate, false);
    }

    /**
     * A step without side effects worth undoing (pure computation).
     */
    static <C> SagaStep<C> withoutCompensation(String name, UnaryOperator<C> execute) {
        return new FunctionalStep<>(name, execute, context -> { }, false);
    }

    /**
     * A step whose external effect cannot be reverted. Compensation is a no-op.
     */
    static <C> SagaStep<C> irreversible(String name, UnaryOperator<C> execute) {
        return new FunctionalStep<>(name, execute, context -> { }, true);
    }

    final class FunctionalStep<C> implements SagaStep<C> {

        private final String name;
        private final UnaryOperator<C> execute;
        private final Consumer<C> compensate;
        private final boolean irreversible;

        private FunctionalStep(String name, UnaryOperator<C> execute, Consumer<C> compensate,
                               boolean irreversible) {
            this.name = Objects.requireNonNull(name, "name");
            this.execute = Objects.requireNonNull(execute, "execute");
            this.compensate = Objects.requireNonNull(compensate, "compensate");
            this.irreversible = irreversible;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public C execute(C context) {
            return execute.apply(context);
        }

        @Override
        public void compensate(C context) {
            compensate.accept(context);
        }

        @Override
        public boolean isIrreversible() {
            return irreversible;
        }

        @Override
        public String toString() {
            return irreversible ? name + " (irreversible)" : name;
        }
    }
}
