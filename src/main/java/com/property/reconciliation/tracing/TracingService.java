package com.property.reconciliation.tracing;

import com.property.reconciliation.core.model.PropertySource;

/**
 * Opens the span around a reconcile call.
 * {@link NoOpTracingService} is the default so the library runs without OpenTelemetry.
 */
public interface TracingService {

    String RECONCILE_SPAN = "property.reconcile";

    ReconcileSpan startReconcile(PropertySource source);
}
