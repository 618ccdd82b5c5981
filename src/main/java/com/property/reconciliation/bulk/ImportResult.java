package com.property.reconciliation.bulk;

import java.util.List;

/**
 * Result of replaying a batch of source updates.
 *
 * @param totalRecords   records read from the input, including failed ones
 * @param created        records that created a new property
 * @param updated        records that changed an existing property
 * @param unchanged      records that changed nothing
 * @param rejectedFields individual field writes refused by trust or permission checks
 * @param errors         records that could not be reconciled at all
 */
public record ImportResult(
        long totalRecords,
        long created,
        long updated,
        long unchanged,
        long rejectedFields,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long successCount() {
        return created + updated + unchanged;
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record that failed.
     *
     * @param lineNumber the line number in the input (1-based, 0 for stream-level failures)
     * @param reference  the listing id or property id of the record, when it could be read
     * @param message    the error message; never contains the address
     */
    public record ImportError(long lineNumber, String reference, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", created=" + created +
                ", updated=" + updated +
                ", unchanged=" + unchanged +
                ", rejectedFields=" + rejectedFields +
                ", errors=" + errors.size() + '}';
    }
}
