package com.fluentchecks.core;

import java.time.Duration;

/**
 * Sleeps for a fixed delay, then evaluates the wrapped check and returns its outcome.
 * <p>
 * Useful for simulating slow conditions and for composing with the polling and
 * background wrappers.
 */
public class DelayedCheck extends Check {

    private final Check check;
    private final Duration delay;
    private final TimeSource timeSource;

    public DelayedCheck(Check check, Duration delay) {
        this(check, delay, TimeSource.system());
    }

    public DelayedCheck(Check check, Duration delay, TimeSource timeSource) {
        this.check = Arguments.requireNonNull(check, "check");
        this.delay = Arguments.requireNonNegative(delay, "delay");
        this.timeSource = Arguments.requireNonNull(timeSource, "timeSource");
    }

    @Override
    protected boolean check() {
        Polling.pause(timeSource, delay);
        return check.evaluate();
    }

    public Duration delay() {
        return delay;
    }

    @Override
    public String toString() {
        return check + " after " + delay;
    }
}
