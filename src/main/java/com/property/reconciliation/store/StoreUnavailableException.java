package com.property.reconciliation.store;

/**
 * The backing store could not be reached or failed mid-operation.
 * Any transaction in flight has been rolled back.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
