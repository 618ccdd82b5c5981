package com.property.reconciliation.crypto;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * A 256-bit AES key plus the short identifier written into every envelope it seals.
 * The identifier is the Base64 of the first 8 bytes of the key's SHA-256 digest,
 * so it reveals nothing usable about the key.
 */
public final class EncryptionKey {

    public static final int KEY_LENGTH_BYTES = 32;

    private final String keyId;
    private final SecretKey secretKey;

    private EncryptionKey(byte[] material) {
        this.keyId = deriveKeyId(material);
        this.secretKey = new SecretKeySpec(material, "AES");
    }

    /**
     * Builds a key from raw bytes.
     *
     * @throws IllegalArgumentException if the material is not exactly 32 bytes
     */
    public static EncryptionKey of(byte[] material) {
        Objects.requireNonNull(material, "key material is required");
        if (material.length != KEY_LENGTH_BYTES) {
            throw new IllegalArgumentException("encryption key must be " + KEY_LENGTH_BYTES
                    + " bytes, got " + material.length);
        }
        return new EncryptionKey(Arrays.copyOf(material, material.length));
    }

    /**
     * Builds a key from its Base64 form, as supplied through the environment.
     */
    public static EncryptionKey fromBase64(String encoded) {
        Objects.requireNonNull(encoded, "encoded key is required");
        byte[] material;
        try {
            material = Base64.getDecoder().decode(encoded.trim().getBytes(StandardCharsets.US_ASCII));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("encryption key is not valid Base64", e);
        }
        return of(material);
    }

    public String keyId() {
        return keyId;
    }

    SecretKey secretKey() {
        return secretKey;
    }

    private static String deriveKeyId(byte[] material) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(material);
            return Base64.getEncoder().encodeToString(Arrays.copyOf(digest, 8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return keyId.equals(((EncryptionKey) o).keyId);
    }

    @Override
    public int hashCode() {
        return keyId.hashCode();
    }

    @Override
    public String toString() {
        return "EncryptionKey{keyId='" + keyId + "'}";
    }
}
