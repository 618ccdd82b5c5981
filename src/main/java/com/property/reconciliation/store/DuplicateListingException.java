package com.property.reconciliation.store;

/**
 * Another live record already owns the listing id.
 */
public class DuplicateListingException extends RuntimeException {

    private final String listingId;

    public DuplicateListingException(String listingId) {
        super("Listing id already assigned: " + listingId);
        this.listingId = listingId;
    }

    public DuplicateListingException(String listingId, Throwable cause) {
        super("Listing id already assigned: " + listingId, cause);
        this.listingId = listingId;
    }

    public String getListingId() {
        return listingId;
    }
}
