package com.fluentchecks.core;

/**
 * Evaluates the wrapped check up to a fixed number of times and is {@code true} as soon
 * as one attempt is.
 */
public class RepeatingOrCheck extends Check {

    private final Check check;
    private final int attempts;

    public RepeatingOrCheck(Check check, int attempts) {
        this.check = Arguments.requireNonNull(check, "check");
        this.attempts = Arguments.requirePositive(attempts, "attempts");
    }

    @Override
    protected boolean check() {
        for (int i = 0; i < attempts; i++) {
            if (check.evaluate()) {
                return true;
            }
        }
        return false;
    }

    public int attempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return check + " within " + attempts + " attempts";
    }
}
