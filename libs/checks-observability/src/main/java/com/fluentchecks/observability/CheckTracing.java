package com.fluentchecks.observability;

import com.fluentchecks.core.Check;
import io.opentelemetry.api.trace.Tracer;

/**
 * Factory for {@link TracedCheck}s that run every evaluation inside an OpenTelemetry span.
 * <p>
 * This helper only uses the OTel API; the SDK (exporter, sampler, resource) is configured by
 * the application.
 */
public final class CheckTracing {

    /** Span attribute carrying the check's description. */
    public static final String ATTR_CHECK = "check.name";

    /** Span attribute carrying the boolean outcome. */
    public static final String ATTR_RESULT = "check.result";

    private final Tracer tracer;

    /**
     * Creates a factory backed by the given OTel tracer.
     *
     * @param tracer the OpenTelemetry tracer (typically obtained from {@code GlobalOpenTelemetry})
     */
    public CheckTracing(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Wraps {@code check} so that each evaluation produces one span named {@code spanName}.
     */
    public TracedCheck trace(String spanName, Check check) {
        if (spanName == null || spanName.isBlank()) {
            throw new IllegalArgumentException("spanName must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        return new TracedCheck(tracer, spanName, check);
    }

    /**
     * Returns the underlying OTel tracer.
     */
    public Tracer tracer() {
        return tracer;
    }
}
