package com.fluentchecks.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * {@link TimeSource} that reads a {@link Clock} and sleeps with {@link Thread#sleep(long, int)}.
 */
final class SystemTimeSource implements TimeSource {

    static final SystemTimeSource INSTANCE = new SystemTimeSource(Clock.systemUTC());

    private final Clock clock;

    SystemTimeSource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        long millis = Durations.toMillis(duration);
        int nanos = millis == Long.MAX_VALUE ? 0 : duration.getNano() % 1_000_000;
        Thread.sleep(millis, nanos);
    }

    @Override
    public String toString() {
        return "SystemTimeSource[" + clock + "]";
    }
}
