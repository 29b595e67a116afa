package com.fluentchecks.core;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base for checks whose outcome depends on how many times they have been evaluated.
 * Each evaluation increments the counter before the comparison, so the current
 * evaluation is included in the count.
 */
public abstract class CountingCheck extends Check {

    private final AtomicInteger timesChecked = new AtomicInteger();
    private final int times;

    protected CountingCheck(int times) {
        if (times < 0) {
            throw new IllegalArgumentException("times must not be negative, was " + times);
        }
        this.times = times;
    }

    @Override
    protected final boolean check() {
        return compare(timesChecked.incrementAndGet(), times);
    }

    /**
     * @param count evaluations so far, including the current one
     * @param times the threshold given at construction
     */
    protected abstract boolean compare(int count, int times);

    /**
     * Returns how many times this check has been evaluated.
     */
    public int timesChecked() {
        return timesChecked.get();
    }

    public int times() {
        return times;
    }
}
