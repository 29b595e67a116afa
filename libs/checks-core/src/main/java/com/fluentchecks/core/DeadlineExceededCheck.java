package com.fluentchecks.core;

import java.time.Instant;

/**
 * {@code true} once the current time is after a fixed deadline.
 */
public class DeadlineExceededCheck extends Check {

    private final Instant deadline;
    private final TimeSource timeSource;

    public DeadlineExceededCheck(Instant deadline) {
        this(deadline, TimeSource.system());
    }

    public DeadlineExceededCheck(Instant deadline, TimeSource timeSource) {
        this.deadline = Arguments.requireNonNull(deadline, "deadline");
        this.timeSource = Arguments.requireNonNull(timeSource, "timeSource");
    }

    @Override
    protected boolean check() {
        return timeSource.now().isAfter(deadline);
    }

    @Override
    public String toString() {
        return "deadline " + deadline + " exceeded";
    }
}
