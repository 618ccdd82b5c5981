package com.property.reconciliation.api;

/**
 * The request is malformed or refers to something that does not exist.
 * Never retried.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
