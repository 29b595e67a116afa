package com.fluentchecks.core;

import java.time.Duration;

/**
 * Reports whether an evaluation of the wrapped check finishes, with any result, within the
 * timeout.
 */
public class FinishesBeforeTimeoutCheck extends CompletionCheck {

    private final Duration timeout;

    public FinishesBeforeTimeoutCheck(Check check, Duration timeout) {
        super(check);
        this.timeout = Arguments.requirePositive(timeout, "timeout");
    }

    @Override
    Duration budget() {
        return timeout;
    }

    @Override
    boolean finished(BackgroundCheck background) {
        background.result();
        return true;
    }

    @Override
    public String toString() {
        return wrapped() + " finishes within " + timeout;
    }
}
