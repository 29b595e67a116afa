/**
 * Observability for check evaluations.
 *
 * <p>{@link com.fluentchecks.observability.CheckMetrics} records Micrometer timers per
 * outcome and {@link com.fluentchecks.observability.CheckTracing} wraps evaluations in
 * OpenTelemetry spans. Both produce ordinary {@link com.fluentchecks.core.Check}s, so they
 * can be placed anywhere in a composed check, for example inside a polling loop to see every
 * attempt.
 */
package com.fluentchecks.observability;
