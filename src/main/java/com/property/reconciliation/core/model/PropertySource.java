package com.property.reconciliation.core.model;

import java.util.Locale;
import java.util.Map;

/**
 * Known integrations that write property data, plus a catch-all tier for
 * anything unrecognized. Unknown sources can create records but rank lowest
 * for every field.
 */
public enum PropertySource {
    /**
     * Listing-syndication scraper (MLS feed).
     */
    LISTING_SYNDICATION,

    /**
     * Manual edits from the admin console.
     */
    ADMIN,

    /**
     * Contact-management platform integration.
     */
    CRM,

    /**
     * Showing/booking pipeline.
     */
    BOOKING,

    UNKNOWN;

    private static final Map<String, PropertySource> IDENTIFIERS = Map.ofEntries(
            Map.entry("har", LISTING_SYNDICATION),
            Map.entry("scraper", LISTING_SYNDICATION),
            Map.entry("listing_sync", LISTING_SYNDICATION),
            Map.entry("listing_syndication", LISTING_SYNDICATION),
            Map.entry("mls", LISTING_SYNDICATION),
            Map.entry("admin", ADMIN),
            Map.entry("manual", ADMIN),
            Map.entry("propertyhub", ADMIN),
            Map.entry("fub", CRM),
            Map.entry("crm", CRM),
            Map.entry("booking", BOOKING),
            Map.entry("booking_pipeline", BOOKING)
    );

    /**
     * Maps a caller-supplied source identifier to its trust tier.
     * Never fails: unrecognized identifiers map to {@link #UNKNOWN}.
     */
    public static PropertySource fromIdentifier(String identifier) {
        if (identifier == null) {
            return UNKNOWN;
        }
        String normalized = identifier.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return IDENTIFIERS.getOrDefault(normalized, UNKNOWN);
    }
}
