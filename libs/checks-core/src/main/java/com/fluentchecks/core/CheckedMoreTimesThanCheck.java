package com.fluentchecks.core;

/**
 * {@code true} once this check has been evaluated more than {@code times} times.
 */
public class CheckedMoreTimesThanCheck extends CountingCheck {

    public CheckedMoreTimesThanCheck(int times) {
        super(times);
    }

    @Override
    protected boolean compare(int count, int times) {
        return count > times;
    }

    @Override
    public String toString() {
        return "checked more than " + times() + " times";
    }
}
