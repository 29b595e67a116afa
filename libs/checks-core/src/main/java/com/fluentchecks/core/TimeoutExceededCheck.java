package com.fluentchecks.core;

import java.time.Duration;
import java.time.Instant;

/**
 * {@code true} once a timeout has elapsed since the check was created.
 */
public class TimeoutExceededCheck extends Check {

    private final Duration timeout;
    private final Instant startedAt;
    private final TimeSource timeSource;

    public TimeoutExceededCheck(Duration timeout) {
        this(timeout, TimeSource.system());
    }

    public TimeoutExceededCheck(Duration timeout, TimeSource timeSource) {
        this.timeout = Arguments.requireNonNegative(timeout, "timeout");
        this.timeSource = Arguments.requireNonNull(timeSource, "timeSource");
        this.startedAt = timeSource.now();
    }

    @Override
    protected boolean check() {
        return timeSource.now().isAfter(startedAt.plus(timeout));
    }

    public Instant startedAt() {
        return startedAt;
    }

    @Override
    public String toString() {
        return "timeout " + timeout + " exceeded";
    }
}
