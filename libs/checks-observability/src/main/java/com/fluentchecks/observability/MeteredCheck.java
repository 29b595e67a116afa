package com.fluentchecks.observability;

import com.fluentchecks.core.Check;
import io.micrometer.core.instrument.Timer;

/**
 * Check that times each evaluation of a wrapped check. Created by
 * {@link CheckMetrics#instrument(String, Check)}.
 * <p>
 * Errors are recorded under the {@code error} outcome and then rethrown unchanged.
 */
public final class MeteredCheck extends Check {

    private final CheckMetrics metrics;
    private final String name;
    private final Check check;

    MeteredCheck(CheckMetrics metrics, String name, Check check) {
        this.metrics = metrics;
        this.name = name;
        this.check = check;
    }

    @Override
    protected boolean check() {
        Timer.Sample sample = Timer.start(metrics.registry());
        String outcome = CheckMetrics.OUTCOME_ERROR;
        try {
            boolean result = check.evaluate();
            outcome = result ? CheckMetrics.OUTCOME_SUCCESS : CheckMetrics.OUTCOME_FAILURE;
            return result;
        } finally {
            sample.stop(metrics.timer(name, outcome));
        }
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return check.toString();
    }
}
