package com.fluentchecks.core;

import java.time.Duration;

/**
 * Settings shared by every polling loop ({@link Check#waitUntilTrue()},
 * {@link Check#succeedsBeforeDeadline}, {@link Check#succeedsWithinTimeout},
 * {@link Check#eventually}).
 * <p>
 * Between two attempts a loop sleeps for {@code interval}, or for whatever is left
 * until its deadline if that is shorter.
 *
 * @param interval   pause between attempts; must be positive
 * @param timeSource clock and sleeper used by the loop
 */
public record PollingConfig(Duration interval, TimeSource timeSource) {

    /** Default pause between two attempts (10 milliseconds). */
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(10);

    private static final PollingConfig DEFAULTS = new PollingConfig(DEFAULT_INTERVAL, TimeSource.system());

    public PollingConfig {
        if (interval == null) {
            throw new IllegalArgumentException("interval must not be null");
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, was " + interval);
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource must not be null");
        }
    }

    /**
     * Returns the default configuration: a 10 ms interval on the system time source.
     */
    public static PollingConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a copy of this configuration with a different interval.
     */
    public PollingConfig withInterval(Duration interval) {
        return new PollingConfig(interval, timeSource);
    }

    /**
     * Returns a copy of this configuration with a different time source.
     */
    public PollingConfig withTimeSource(TimeSource timeSource) {
        return new PollingConfig(interval, timeSource);
    }
}
