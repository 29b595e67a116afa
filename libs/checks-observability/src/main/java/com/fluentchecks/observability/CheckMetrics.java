package com.fluentchecks.observability;

import com.fluentchecks.core.Check;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for {@link MeteredCheck}s that record every evaluation as a Micrometer timer.
 * <p>
 * Each instrumented check records into the {@value #METRIC_NAME} timer, tagged with
 * {@value #TAG_CHECK} (the name given to {@link #instrument(String, Check)}) and
 * {@value #TAG_OUTCOME} ({@code success}, {@code failure} or {@code error}). Common tags
 * supplied at construction are added to every meter.
 * <p>
 * Example usage:
 * <pre>{@code
 * CheckMetrics metrics = new CheckMetrics(registry, "service", "orders");
 * Check ready = metrics.instrument("db-ready", Checks.of(db::isReady));
 * ready.eventually(Duration.ofSeconds(30)).evaluate();
 * }</pre>
 */
public final class CheckMetrics {

    /** Timer recording check evaluations. */
    public static final String METRIC_NAME = "fluent.check.evaluation";

    /** Tag key for the instrumented check's name. */
    public static final String TAG_CHECK = "check";

    /** Tag key for the evaluation outcome. */
    public static final String TAG_OUTCOME = "outcome";

    static final String OUTCOME_SUCCESS = "success";
    static final String OUTCOME_FAILURE = "failure";
    static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;
    private final Tags commonTags;

    /**
     * Creates a factory bound to the given registry.
     *
     * @param registry   the Micrometer meter registry
     * @param commonTags tags added to every meter (key-value pairs)
     */
    public CheckMetrics(MeterRegistry registry, String... commonTags) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
        this.commonTags = Tags.of(commonTags);
    }

    /**
     * Wraps {@code check} so that each evaluation is timed and counted by outcome.
     *
     * @param name  value of the {@value #TAG_CHECK} tag
     * @param check the check to instrument
     * @return the instrumented check
     */
    public MeteredCheck instrument(String name, Check check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        return new MeteredCheck(this, name, check);
    }

    /**
     * Returns the timer for the given check name and outcome, registering it on first use.
     */
    Timer timer(String checkName, String outcome) {
        return Timer.builder(METRIC_NAME)
                .description("Time spent evaluating a check")
                .tags(commonTags.and(TAG_CHECK, checkName, TAG_OUTCOME, outcome))
                .register(registry);
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }
}
