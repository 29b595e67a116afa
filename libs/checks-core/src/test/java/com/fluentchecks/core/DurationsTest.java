package com.fluentchecks.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Durations")
class DurationsTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("should add ordinary durations exactly")
    void shouldAddExactly() {
        assertThat(Durations.plus(NOW, Duration.ofSeconds(5))).isEqualTo(NOW.plusSeconds(5));
    }

    @Test
    @DisplayName("should saturate at Instant.MAX")
    void shouldSaturateInstant() {
        assertThat(Durations.plus(NOW, Duration.ofSeconds(Long.MAX_VALUE))).isEqualTo(Instant.MAX);
        assertThat(Durations.plus(NOW, Duration.between(NOW, Instant.MAX))).isEqualTo(Instant.MAX);
    }

    @Test
    @DisplayName("should clamp nanos and millis to Long.MAX_VALUE")
    void shouldClampUnits() {
        assertThat(Durations.toNanos(Duration.ofMillis(3))).isEqualTo(3_000_000L);
        assertThat(Durations.toNanos(Duration.ofDays(365L * 400))).isEqualTo(Long.MAX_VALUE);
        assertThat(Durations.toMillis(Duration.ofSeconds(2))).isEqualTo(2_000L);
        assertThat(Durations.toMillis(Duration.ofSeconds(Long.MAX_VALUE))).isEqualTo(Long.MAX_VALUE);
    }
}
