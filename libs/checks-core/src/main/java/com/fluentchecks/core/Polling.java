package com.fluentchecks.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Blocking loops shared by the polling checks.
 */
final class Polling {

    private static final Logger log = LoggerFactory.getLogger(Polling.class);

    private Polling() {
        // utility class
    }

    /**
     * Evaluates {@code check} until it returns {@code true} with its evaluation finished
     * no later than {@code deadline}.
     * <p>
     * At least one attempt is always made. An attempt that finishes after the deadline
     * never counts as a success, whatever it returned. Errors raised by the check abort
     * the loop.
     */
    static boolean untilDeadline(Check check, Instant deadline, PollingConfig config) {
        TimeSource time = config.timeSource();
        Instant startedAt = time.now();
        int attempts = 0;
        while (true) {
            attempts++;
            boolean result = check.evaluate();
            Instant finishedAt = time.now();
            if (finishedAt.isAfter(deadline)) {
                log.debug("{} missed deadline {} after {} attempt(s)", check, deadline, attempts);
                return false;
            }
            if (result) {
                log.debug("{} succeeded after {} attempt(s) in {}",
                        check, attempts, Duration.between(startedAt, finishedAt));
                return true;
            }
            Duration remaining = Duration.between(finishedAt, deadline);
            if (remaining.isZero()) {
                log.debug("{} still false at deadline {} after {} attempt(s)", check, deadline, attempts);
                return false;
            }
            pause(time, min(config.interval(), remaining));
        }
    }

    /**
     * Evaluates {@code check} until it returns {@code true}, with no upper bound.
     */
    static void untilTrue(Check check, PollingConfig config) {
        int attempts = 0;
        while (true) {
            attempts++;
            if (check.evaluate()) {
                log.debug("{} became true after {} attempt(s)", check, attempts);
                return;
            }
            pause(config.timeSource(), config.interval());
        }
    }

    /**
     * Sleeps on the given time source, translating interruption into
     * {@link CheckInterruptedException} with the interrupt flag restored.
     */
    static void pause(TimeSource time, Duration duration) {
        try {
            time.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CheckInterruptedException("Interrupted while sleeping for " + duration, e);
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
