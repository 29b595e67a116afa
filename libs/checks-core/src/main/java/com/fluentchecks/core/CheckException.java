package com.fluentchecks.core;

/**
 * Base class for errors raised by the check machinery itself.
 * <p>
 * Errors raised by a wrapped {@link Condition} are not converted to this type unless
 * they are checked exceptions (see {@link CheckEvaluationException}).
 */
public class CheckException extends RuntimeException {

    public CheckException(String message) {
        super(message);
    }

    public CheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
