package com.fluentchecks.core.testing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ManualTimeSource} validating manual advancing and sleep accounting.
 */
@DisplayName("ManualTimeSource")
class ManualTimeSourceTest {

    @Test
    @DisplayName("should start at the epoch by default")
    void shouldStartAtEpoch() {
        assertThat(new ManualTimeSource().now()).isEqualTo(Instant.EPOCH);
    }

    @Test
    @DisplayName("should advance the clock on sleep without blocking")
    void shouldAdvanceOnSleep() {
        var time = new ManualTimeSource(Instant.parse("2024-06-01T12:00:00Z"));

        long start = System.nanoTime();
        time.sleep(Duration.ofHours(1));
        time.sleep(Duration.ofMinutes(30));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
        assertThat(time.now()).isEqualTo(Instant.parse("2024-06-01T13:30:00Z"));
        assertThat(time.sleeps()).isEqualTo(2);
        assertThat(time.totalSlept()).isEqualTo(Duration.ofMinutes(90));
    }

    @Test
    @DisplayName("should advance manually without counting a sleep")
    void shouldAdvanceManually() {
        var time = new ManualTimeSource().advance(Duration.ofSeconds(5));

        assertThat(time.now()).isEqualTo(Instant.EPOCH.plusSeconds(5));
        assertThat(time.sleeps()).isZero();
    }

    @Test
    @DisplayName("should reject negative advances")
    void shouldRejectNegativeAdvance() {
        assertThatThrownBy(() -> new ManualTimeSource().advance(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
