package com.fluentchecks.core;

/**
 * Polls the wrapped check until it is {@code true}, pausing {@link PollingConfig#interval()}
 * between attempts. There is no upper bound on the wait.
 */
public class WaitForTrueCheck extends Check {

    private final Check check;
    private final PollingConfig config;

    public WaitForTrueCheck(Check check) {
        this(check, PollingConfig.defaults());
    }

    public WaitForTrueCheck(Check check, PollingConfig config) {
        this.check = Arguments.requireNonNull(check, "check");
        this.config = Arguments.requireNonNull(config, "config");
    }

    @Override
    protected boolean check() {
        Polling.untilTrue(check, config);
        return true;
    }

    @Override
    public String toString() {
        return "wait until " + check;
    }
}
