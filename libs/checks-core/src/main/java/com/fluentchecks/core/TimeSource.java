package com.fluentchecks.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * The single boundary through which checks read the current time and sleep.
 * <p>
 * Deadline arithmetic, delays and polling pauses all go through a {@code TimeSource},
 * so tests can substitute {@link com.fluentchecks.core.testing.ManualTimeSource} and
 * run timing scenarios without real waiting.
 */
public interface TimeSource {

    /**
     * Returns the current instant.
     */
    Instant now();

    /**
     * Blocks the calling thread for the given duration.
     *
     * @param duration how long to sleep (zero returns immediately)
     * @throws InterruptedException if the thread is interrupted while sleeping
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * Returns the wall-clock time source backed by {@link Clock#systemUTC()} and
     * {@link Thread#sleep(long, int)}.
     */
    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }

    /**
     * Returns a time source reading from the given clock and sleeping on the calling thread.
     *
     * @param clock the clock to read
     */
    static TimeSource of(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        return new SystemTimeSource(clock);
    }
}
