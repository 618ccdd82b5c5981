package com.property.reconciliation.stats;

import com.property.reconciliation.core.model.PropertyStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dashboard summary of the catalog, as of {@code computedAt}.
 *
 * @param total              all records, terminal ones included
 * @param byStatus           count per status; every status is present
 * @param listedCount        active plus available records
 * @param averageListedPrice mean price over listed records with a price, or {@code null} if none
 */
public record PropertyStats(long total,
                            Map<PropertyStatus, Long> byStatus,
                            long listedCount,
                            BigDecimal averageListedPrice,
                            Instant computedAt) {

    public PropertyStats {
        Objects.requireNonNull(computedAt, "computedAt is required");
        EnumMap<PropertyStatus, Long> copy = new EnumMap<>(PropertyStatus.class);
        for (PropertyStatus status : PropertyStatus.values()) {
            copy.put(status, 0L);
        }
        if (byStatus != null) {
            copy.putAll(byStatus);
        }
        byStatus = Collections.unmodifiableMap(copy);
    }

    public long count(PropertyStatus status) {
        return byStatus.get(status);
    }

    /**
     * Records still awaiting media before they can be published.
     */
    public long pendingImagesCount() {
        return count(PropertyStatus.PENDING_IMAGES);
    }
}
