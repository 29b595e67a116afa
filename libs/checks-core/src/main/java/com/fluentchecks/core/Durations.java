package com.fluentchecks.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Saturating time arithmetic. Very long timeouts and far deadlines mean "wait forever",
 * so results clamp at the representable limit instead of overflowing.
 */
final class Durations {

    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);
    private static final Duration MAX_MILLIS = Duration.ofMillis(Long.MAX_VALUE);

    private Durations() {
        // utility class
    }

    /**
     * Returns {@code instant + duration}, or {@link Instant#MAX} if that lies beyond it.
     */
    static Instant plus(Instant instant, Duration duration) {
        if (duration.compareTo(Duration.between(instant, Instant.MAX)) >= 0) {
            return Instant.MAX;
        }
        return instant.plus(duration);
    }

    /**
     * Returns the duration in nanoseconds, clamped to {@link Long#MAX_VALUE}.
     */
    static long toNanos(Duration duration) {
        return duration.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : duration.toNanos();
    }

    /**
     * Returns the duration in milliseconds, clamped to {@link Long#MAX_VALUE}.
     */
    static long toMillis(Duration duration) {
        return duration.compareTo(MAX_MILLIS) >= 0 ? Long.MAX_VALUE : duration.toMillis();
    }
}
