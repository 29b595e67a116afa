package com.fluentchecks.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fluentchecks.core.Check;
import com.fluentchecks.core.Checks;
import com.fluentchecks.core.testing.ScriptedCondition;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CheckMetrics} and {@link MeteredCheck} validating per-outcome timers,
 * common tags and error pass-through.
 */
@DisplayName("CheckMetrics")
class CheckMetricsTest {

    private SimpleMeterRegistry registry;
    private CheckMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CheckMetrics(registry, "service", "test-service");
    }

    private Timer timer(String check, String outcome) {
        return registry.find(CheckMetrics.METRIC_NAME)
                .tags(CheckMetrics.TAG_CHECK, check, CheckMetrics.TAG_OUTCOME, outcome)
                .timer();
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new CheckMetrics(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank name and null check")
        void shouldRejectInvalidInstrumentArguments() {
            assertThatThrownBy(() -> metrics.instrument(" ", Checks.always()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("name");
            assertThatThrownBy(() -> metrics.instrument("x", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("check");
        }

        @Test
        @DisplayName("should expose the registry")
        void shouldExposeRegistry() {
            assertThat(metrics.registry()).isSameAs(registry);
        }
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        @DisplayName("should record successes and failures separately")
        void shouldRecordByOutcome() {
            var check = metrics.instrument("ready", Checks.of(new ScriptedCondition().thenReturn(false, false, true)));

            check.evaluate();
            check.evaluate();
            check.evaluate();

            assertThat(timer("ready", "failure").count()).isEqualTo(2);
            assertThat(timer("ready", "success").count()).isEqualTo(1);
        }

        @Test
        @DisplayName("should record errors and rethrow them")
        void shouldRecordErrors() {
            var check = metrics.instrument("broken", Checks.of(() -> {
                throw new IllegalStateException("down");
            }));

            assertThatThrownBy(check::evaluate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("down");
            assertThat(timer("broken", "error").count()).isEqualTo(1);
        }

        @Test
        @DisplayName("should record every attempt of a polling loop")
        void shouldRecordEveryAttempt() {
            MeteredCheck check = metrics.instrument("counter", Checks.of(new ScriptedCondition().thenReturn(false, true)));

            assertThat(check.succeedsWithinAttempts(5).evaluate()).isTrue();

            assertThat(timer("counter", "failure").count()).isEqualTo(1);
            assertThat(timer("counter", "success").count()).isEqualTo(1);
        }

        @Test
        @DisplayName("should apply common tags")
        void shouldApplyCommonTags() {
            metrics.instrument("tagged", Checks.always()).evaluate();

            Timer timer = timer("tagged", "success");
            assertThat(timer.getId().getTag("service")).isEqualTo("test-service");
        }

        @Test
        @DisplayName("should keep the wrapped check's description and its own callbacks")
        void shouldKeepDescriptionAndCallbacks() {
            var successes = new int[1];
            Check check = metrics.instrument("described", Checks.of("db ready", () -> true))
                    .onSuccess(() -> successes[0]++);

            check.evaluate();

            assertThat(check.toString()).isEqualTo("db ready");
            assertThat(successes[0]).isEqualTo(1);
        }
    }
}
