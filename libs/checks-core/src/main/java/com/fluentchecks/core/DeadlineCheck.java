package com.fluentchecks.core;

import java.time.Instant;

/**
 * Polls the wrapped check until it succeeds or a fixed deadline passes.
 * <p>
 * An attempt counts only if it returned {@code true} and finished at or before the
 * deadline. One attempt is always made, even when the deadline has already passed.
 */
public class DeadlineCheck extends Check {

    private final Check check;
    private final Instant deadline;
    private final PollingConfig config;

    public DeadlineCheck(Check check, Instant deadline) {
        this(check, deadline, PollingConfig.defaults());
    }

    public DeadlineCheck(Check check, Instant deadline, PollingConfig config) {
        this.check = Arguments.requireNonNull(check, "check");
        this.deadline = Arguments.requireNonNull(deadline, "deadline");
        this.config = Arguments.requireNonNull(config, "config");
    }

    @Override
    protected boolean check() {
        return Polling.untilDeadline(check, deadline, config);
    }

    public Instant deadline() {
        return deadline;
    }

    @Override
    public String toString() {
        return check + " before " + deadline;
    }
}
