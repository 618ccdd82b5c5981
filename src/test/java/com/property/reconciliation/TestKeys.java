package com.property.reconciliation;

import com.property.reconciliation.crypto.AesGcmFieldCodec;
import com.property.reconciliation.crypto.EncryptionKey;
import com.property.reconciliation.crypto.KeyRing;

import java.util.Arrays;
import java.util.Base64;

/**
 * Deterministic key material for tests.
 */
public final class TestKeys {

    private TestKeys() {
    }

    public static EncryptionKey key(int seed) {
        byte[] material = new byte[EncryptionKey.KEY_LENGTH_BYTES];
        Arrays.fill(material, (byte) seed);
        return EncryptionKey.of(material);
    }

    public static String base64(int seed) {
        byte[] material = new byte[EncryptionKey.KEY_LENGTH_BYTES];
        Arrays.fill(material, (byte) seed);
        return Base64.getEncoder().encodeToString(material);
    }

    public static KeyRing ring() {
        return KeyRing.of(key(1));
    }

    public static AesGcmFieldCodec codec() {
        return new AesGcmFieldCodec(ring());
    }
}
