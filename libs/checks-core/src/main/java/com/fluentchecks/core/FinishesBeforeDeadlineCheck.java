package com.fluentchecks.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Reports whether an evaluation of the wrapped check finishes, with any result, before the
 * deadline. The deadline is compared against the system clock, since the wait runs on real time.
 * <p>
 * If the evaluation raised an error and finished in time, the error is rethrown.
 */
public class FinishesBeforeDeadlineCheck extends CompletionCheck {

    private final Instant deadline;

    public FinishesBeforeDeadlineCheck(Check check, Instant deadline) {
        super(check);
        this.deadline = Arguments.requireNonNull(deadline, "deadline");
    }

    @Override
    Duration budget() {
        return Duration.between(TimeSource.system().now(), deadline);
    }

    @Override
    boolean finished(BackgroundCheck background) {
        background.result();
        return true;
    }

    @Override
    public String toString() {
        return wrapped() + " finishes before " + deadline;
    }
}
