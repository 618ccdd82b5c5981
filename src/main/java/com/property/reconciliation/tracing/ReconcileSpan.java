package com.property.reconciliation.tracing;

/**
 * Trace of one reconcile call. Closing the span ends it.
 */
public interface ReconcileSpan extends AutoCloseable {

    /**
     * @param propertyId record the call resolved to
     * @param result     {@code created}, {@code updated} or {@code unchanged}
     * @param retries    re-attempts after lost concurrent writes
     */
    void finished(String propertyId, String result, int retries);

    void failed(RuntimeException error);

    @Override
    void close();
}
