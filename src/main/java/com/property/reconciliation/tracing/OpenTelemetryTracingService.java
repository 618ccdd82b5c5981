package com.property.reconciliation.tracing;

import com.property.reconciliation.core.model.PropertySource;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Objects;

/**
 * {@link TracingService} on top of an OpenTelemetry {@link Tracer}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Span attributes: {@code source} (trust tier) at start; {@code propertyId},
 * {@code reconcile.result} and {@code reconcile.retries} on success. The address never
 * reaches a span.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    @Override
    public ReconcileSpan startReconcile(PropertySource source) {
        Span span = tracer.spanBuilder(RECONCILE_SPAN)
                .setAttribute("source", source.name())
                .startSpan();
        return new OTelReconcileSpan(span);
    }

    private static final class OTelReconcileSpan implements ReconcileSpan {

        private final Span span;

        private OTelReconcileSpan(Span span) {
            this.span = span;
        }

        @Override
        public void finished(String propertyId, String result, int retries) {
            if (propertyId != null) {
                span.setAttribute("propertyId", propertyId);
            }
            span.setAttribute("reconcile.result", result);
            span.setAttribute("reconcile.retries", (long) retries);
            span.setStatus(StatusCode.OK);
        }

        @Override
        public void failed(RuntimeException error) {
            span.recordException(error);
            span.setStatus(StatusCode.ERROR, error.getClass().getSimpleName());
        }

        @Override
        public void close() {
            span.end();
        }
    }
}
