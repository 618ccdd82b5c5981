package com.property.reconciliation.crypto;

/**
 * Thrown when an encrypted field cannot be opened with any configured key:
 * malformed envelope, tampered ciphertext, or a key that has left the ring.
 * Messages never carry plaintext.
 */
public class DecryptionException extends RuntimeException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
