package com.property.reconciliation.bulk;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.property.reconciliation.api.PropertyStateManager;
import com.property.reconciliation.api.ValidationException;
import com.property.reconciliation.logging.LogContext;
import com.property.reconciliation.reconcile.ReconciliationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Replays source updates from JSON Lines (one object per line) through the reconciliation engine,
 * for backfills and for re-driving webhook payloads that failed upstream.
 *
 * <pre>
 * {"source": "har", "mls_id": "MLS1", "address": "1 Main St", "price": 300000}
 * {"source": "fub", "mls_id": "MLS1", "agent": "Dana Reyes"}
 * </pre>
 *
 * <p>A JSON array with one object per line is accepted too:</p>
 * <pre>
 * [
 *   {"source": "har", "mls_id": "MLS1", "address": "1 Main St"},
 *   {"source": "booking", "mls_id": "MLS1", "status": "pending"}
 * ]
 * </pre>
 *
 * <p>Records are applied in input order. A failing record is reported and skipped; it never
 * stops the batch. Error messages are built from the failure type, never from the payload,
 * so addresses do not reach the result or the log.</p>
 */
public class JsonUpdateImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonUpdateImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final PropertyStateManager manager;
    private final ObjectMapper objectMapper;

    public JsonUpdateImporter(PropertyStateManager manager) {
        this(manager, new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
    }

    public JsonUpdateImporter(PropertyStateManager manager, ObjectMapper objectMapper) {
        this.manager = Objects.requireNonNull(manager, "manager is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    public ImportResult importUpdates(InputStream input, ProgressCallback callback) {
        return importUpdates(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    public ImportResult importUpdates(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ImportResult.ImportError> errors = new ArrayList<>();

        long totalRecords = 0;
        long created = 0;
        long updated = 0;
        long unchanged = 0;
        long rejectedFields = 0;

        try (LogContext ctx = LogContext.forImport(UUID.randomUUID().toString());
             BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                line = line.trim();

                if (line.isEmpty() || line.equals("[") || line.equals("]") || line.equals(",")) {
                    continue;
                }
                if (line.endsWith(",")) {
                    line = line.substring(0, line.length() - 1);
                }
                totalRecords++;

                String reference = null;
                try {
                    PropertyUpdatePayload payload = objectMapper.readValue(line, PropertyUpdatePayload.class);
                    reference = payload.reference();
                    ReconciliationOutcome outcome = manager.reconcile(payload.toRequest()).outcome();
                    if (outcome.created()) {
                        created++;
                    } else if (outcome.persisted()) {
                        updated++;
                    } else {
                        unchanged++;
                    }
                    rejectedFields += outcome.rejected().size();
                } catch (JsonProcessingException e) {
                    String message = malformed(e);
                    errors.add(new ImportResult.ImportError(lineNumber, reference, message));
                    log.warn("import.error line={} error={}", lineNumber, message);
                } catch (ValidationException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, reference, e.getMessage()));
                    log.warn("import.error line={} reference={} error={}", lineNumber, reference, e.getMessage());
                } catch (RuntimeException e) {
                    String message = e.getClass().getSimpleName() + ": " + e.getMessage();
                    errors.add(new ImportResult.ImportError(lineNumber, reference, message));
                    log.warn("import.error line={} reference={} error={}", lineNumber, reference, message);
                }

                if (totalRecords % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRecords, -1, "Processed " + totalRecords + " records");
                }
            }
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, null, "IO error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(totalRecords, created, updated, unchanged, rejectedFields, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed result={}", result);
        return result;
    }

    private static String malformed(JsonProcessingException e) {
        JsonLocation location = e.getLocation();
        if (location == null || location.getColumnNr() < 0) {
            return "Malformed JSON record";
        }
        return "Malformed JSON at column " + location.getColumnNr();
    }
}
