package com.fluentchecks.core;

/**
 * Carries a checked exception thrown by a {@link Condition} out of {@link Check#evaluate()}.
 * <p>
 * The original exception is always available as {@link #getCause()}, and
 * {@link Check#raises(Class)} matches against it rather than against this wrapper.
 */
public class CheckEvaluationException extends CheckException {

    public CheckEvaluationException(Throwable cause) {
        super("Condition failed: " + cause, cause);
    }
}
