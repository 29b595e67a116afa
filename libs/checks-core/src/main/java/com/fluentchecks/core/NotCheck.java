package com.fluentchecks.core;

/**
 * Negation of a single check.
 */
public class NotCheck extends Check {

    private final Check check;

    public NotCheck(Check check) {
        this.check = Arguments.requireNonNull(check, "check");
    }

    @Override
    protected boolean check() {
        return !check.evaluate();
    }

    public Check negated() {
        return check;
    }

    @Override
    public String toString() {
        return "not " + check;
    }
}
