package com.fluentchecks.core;

/**
 * Thrown when an operation is attempted on a {@link BackgroundCheck} in a state that
 * does not allow it, for example starting it twice or reading its result while it is
 * still running.
 * <p>
 * A state violation is a programming error, so it is never retried.
 */
public class CheckStateException extends CheckException {

    private final String operation;
    private final BackgroundState expected;
    private final BackgroundState actual;

    public CheckStateException(String operation, BackgroundState expected, BackgroundState actual) {
        super("Cannot %s background check: state must be %s but was %s"
                .formatted(operation, expected, actual));
        this.operation = operation;
        this.expected = expected;
        this.actual = actual;
    }

    public String operation() {
        return operation;
    }

    public BackgroundState expected() {
        return expected;
    }

    public BackgroundState actual() {
        return actual;
    }
}
