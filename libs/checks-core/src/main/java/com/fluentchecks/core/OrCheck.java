package com.fluentchecks.core;

/**
 * Disjunction of two checks. The right operand is evaluated only when the left one is
 * {@code false}.
 */
public class OrCheck extends Check {

    private final Check left;
    private final Check right;

    public OrCheck(Check left, Check right) {
        this.left = Arguments.requireNonNull(left, "left");
        this.right = Arguments.requireNonNull(right, "right");
    }

    @Override
    protected boolean check() {
        if (left.evaluate()) {
            return true;
        }
        return right.evaluate();
    }

    public Check left() {
        return left;
    }

    public Check right() {
        return right;
    }

    @Override
    public String toString() {
        return "(" + left + " or " + right + ")";
    }
}
