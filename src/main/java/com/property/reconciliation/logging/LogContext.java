package com.property.reconciliation.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scoped MDC entries for structured logging. On {@link #close()} every key this context
 * touched gets back the value it had before (or is removed), so an inner scope such as a
 * reconcile inside an import leaves the outer scope's entries intact.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forReconcile(correlationId, "har", "MLS-1")) {
 *     log.info("reconcile.committed propertyId={} version={}", id, version);
 * }
 * </pre>
 *
 * Never put a decrypted address into the context.
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String SOURCE = "source";
    public static final String LISTING_ID = "listingId";
    public static final String OPERATION = "operation";

    // Value each key had before this context first set it; null means absent.
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forReconcile(String correlationId, String source, String listingId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(SOURCE, source);
        if (listingId != null) {
            ctx.put(LISTING_ID, listingId);
        }
        ctx.put(OPERATION, "reconcile");
        return ctx;
    }

    public static LogContext forImport(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put(OPERATION, "import");
        return ctx;
    }

    public static LogContext forConflictResolution(String conflictId, String actor) {
        LogContext ctx = new LogContext();
        ctx.put("conflictId", conflictId);
        ctx.put("actor", actor);
        ctx.put(OPERATION, "resolve-conflict");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
