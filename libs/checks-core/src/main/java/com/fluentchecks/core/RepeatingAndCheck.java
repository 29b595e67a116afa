package com.fluentchecks.core;

/**
 * Evaluates the wrapped check up to a fixed number of times and is {@code true} only if
 * every attempt is. Stops at the first {@code false}.
 */
public class RepeatingAndCheck extends Check {

    private final Check check;
    private final int attempts;

    public RepeatingAndCheck(Check check, int attempts) {
        this.check = Arguments.requireNonNull(check, "check");
        this.attempts = Arguments.requirePositive(attempts, "attempts");
    }

    @Override
    protected boolean check() {
        for (int i = 0; i < attempts; i++) {
            if (!check.evaluate()) {
                return false;
            }
        }
        return true;
    }

    public int attempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return check + " for " + attempts + " attempts";
    }
}
