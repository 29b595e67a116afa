package com.fluentchecks.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Polls the wrapped check for at most a fixed timeout.
 * <p>
 * The deadline is computed once per evaluation, as {@code now + timeout} at the moment the
 * evaluation starts (saturating at {@link Instant#MAX}), and the loop then behaves exactly like {@link DeadlineCheck}.
 */
public class TimeoutCheck extends Check {

    private final Check check;
    private final Duration timeout;
    private final PollingConfig config;

    public TimeoutCheck(Check check, Duration timeout) {
        this(check, timeout, PollingConfig.defaults());
    }

    public TimeoutCheck(Check check, Duration timeout, PollingConfig config) {
        this.check = Arguments.requireNonNull(check, "check");
        this.timeout = Arguments.requirePositive(timeout, "timeout");
        this.config = Arguments.requireNonNull(config, "config");
    }

    @Override
    protected boolean check() {
        Instant deadline = Durations.plus(config.timeSource().now(), timeout);
        return Polling.untilDeadline(check, deadline, config);
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return check + " within " + timeout;
    }
}
