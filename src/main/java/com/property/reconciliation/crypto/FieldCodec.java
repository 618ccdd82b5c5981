package com.property.reconciliation.crypto;

/**
 * Reversible keyed encryption of a single string field.
 * This is the only place a plaintext address and its ciphertext meet.
 */
public interface FieldCodec {

    /**
     * Encrypts a value. Non-deterministic: the same plaintext yields a different
     * ciphertext on every call.
     *
     * @param plaintext the value to seal, never {@code null}
     * @return the serialized envelope
     */
    String encrypt(String plaintext);

    /**
     * Opens an envelope produced by {@link #encrypt(String)} with the current or a prior key.
     *
     * @throws DecryptionException if the envelope is malformed, tampered with, or sealed
     *                             by a key that is not configured
     */
    String decrypt(String ciphertext);
}
