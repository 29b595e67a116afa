package com.fluentchecks.observability;

import com.fluentchecks.core.Check;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Check that evaluates a wrapped check inside an INTERNAL span. Created by
 * {@link CheckTracing#trace(String, Check)}.
 * <p>
 * The span is current while the wrapped check runs, so spans opened by nested traced checks
 * become its children. A {@code false} result is not an error: the span status is OK and
 * {@value CheckTracing#ATTR_RESULT} records the outcome. Exceptions set the status to ERROR,
 * are recorded on the span and are rethrown.
 */
public final class TracedCheck extends Check {

    private final Tracer tracer;
    private final String spanName;
    private final Check check;

    TracedCheck(Tracer tracer, String spanName, Check check) {
        this.tracer = tracer;
        this.spanName = spanName;
        this.check = check;
    }

    @Override
    protected boolean check() {
        Span span = tracer.spanBuilder(spanName)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(CheckTracing.ATTR_CHECK, check.toString())
                .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            boolean result = check.evaluate();
            span.setAttribute(CheckTracing.ATTR_RESULT, result);
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException | Error e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public String toString() {
        return check.toString();
    }
}
