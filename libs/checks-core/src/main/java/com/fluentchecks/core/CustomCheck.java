package com.fluentchecks.core;

/**
 * Leaf check wrapping a single {@link Condition}.
 * <p>
 * Unchecked exceptions and errors raised by the condition propagate unchanged.
 * Checked exceptions are wrapped in {@link CheckEvaluationException}; an
 * {@link InterruptedException} additionally restores the thread's interrupt flag.
 */
public class CustomCheck extends Check {

    private final String description;
    private final Condition condition;

    public CustomCheck(Condition condition) {
        this("CustomCheck", condition);
    }

    /**
     * @param description text returned by {@link #toString()}
     * @param condition   the condition to evaluate
     */
    public CustomCheck(String description, Condition condition) {
        this.description = Arguments.requireNonNull(description, "description");
        this.condition = Arguments.requireNonNull(condition, "condition");
    }

    @Override
    protected boolean check() {
        try {
            return condition.test();
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CheckEvaluationException(e);
        } catch (Exception e) {
            throw new CheckEvaluationException(e);
        }
    }

    @Override
    public String toString() {
        return description;
    }
}
