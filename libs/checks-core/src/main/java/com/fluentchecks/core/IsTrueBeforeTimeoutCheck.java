package com.fluentchecks.core;

import java.time.Duration;

/**
 * {@code true} only if an evaluation of the wrapped check finishes within the timeout and
 * returns {@code true}.
 */
public class IsTrueBeforeTimeoutCheck extends CompletionCheck {

    private final Duration timeout;

    public IsTrueBeforeTimeoutCheck(Check check, Duration timeout) {
        super(check);
        this.timeout = Arguments.requirePositive(timeout, "timeout");
    }

    @Override
    Duration budget() {
        return timeout;
    }

    @Override
    boolean finished(BackgroundCheck background) {
        return background.result();
    }

    @Override
    public String toString() {
        return wrapped() + " is true within " + timeout;
    }
}
