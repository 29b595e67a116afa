package com.fluentchecks.core;

/**
 * {@code true} while this check has been evaluated fewer than {@code times} times.
 */
public class CheckedLessTimesThanCheck extends CountingCheck {

    public CheckedLessTimesThanCheck(int times) {
        super(times);
    }

    @Override
    protected boolean compare(int count, int times) {
        return count < times;
    }

    @Override
    public String toString() {
        return "checked less than " + times() + " times";
    }
}
