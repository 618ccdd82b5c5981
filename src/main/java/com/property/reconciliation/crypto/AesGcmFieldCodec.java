package com.property.reconciliation.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;

/**
 * AES-256-GCM codec with a fresh 96-bit IV per call.
 * Stateless apart from the read-only {@link KeyRing}; safe for concurrent use.
 */
public class AesGcmFieldCodec implements FieldCodec {
    private static final Logger log = LoggerFactory.getLogger(AesGcmFieldCodec.class);

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH_BYTES = 12;
    private static final int TAG_LENGTH_BITS = 128;

    private final KeyRing keyRing;
    private final SecureRandom random;

    public AesGcmFieldCodec(KeyRing keyRing) {
        this(keyRing, new SecureRandom());
    }

    AesGcmFieldCodec(KeyRing keyRing, SecureRandom random) {
        this.keyRing = Objects.requireNonNull(keyRing, "keyRing is required");
        this.random = random;
        log.info("AesGcmFieldCodec initialized: currentKeyId={}, priorKeys={}",
                keyRing.current().keyId(), keyRing.previous().size());
    }

    @Override
    public String encrypt(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext is required");
        EncryptionKey key = keyRing.current();
        byte[] iv = new byte[IV_LENGTH_BYTES];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key.secretKey(), new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            Base64.Encoder encoder = Base64.getEncoder();
            return new CipherEnvelope(key.keyId(), encoder.encodeToString(iv), encoder.encodeToString(sealed))
                    .toJson();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Field encryption failed with key " + key.keyId(), e);
        }
    }

    @Override
    public String decrypt(String ciphertext) {
        CipherEnvelope envelope = CipherEnvelope.parse(ciphertext);
        byte[] iv;
        byte[] sealed;
        try {
            iv = Base64.getDecoder().decode(envelope.iv());
            sealed = Base64.getDecoder().decode(envelope.ciphertext());
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Ciphertext envelope is not valid Base64");
        }
        if (iv.length != IV_LENGTH_BYTES) {
            throw new DecryptionException("Ciphertext envelope has an invalid IV length");
        }

        for (EncryptionKey key : keyRing.openingOrder(envelope.keyId())) {
            try {
                Cipher cipher = Cipher.getInstance(TRANSFORMATION);
                cipher.init(Cipher.DECRYPT_MODE, key.secretKey(), new GCMParameterSpec(TAG_LENGTH_BITS, iv));
                byte[] plain = cipher.doFinal(sealed);
                if (!key.equals(keyRing.current())) {
                    log.debug("codec.opened_with_prior_key keyId={}", key.keyId());
                }
                return new String(plain, StandardCharsets.UTF_8);
            } catch (AEADBadTagException e) {
                log.trace("codec.key_rejected keyId={}", key.keyId());
            } catch (GeneralSecurityException e) {
                throw new DecryptionException("Field decryption failed: " + e.getClass().getSimpleName(), e);
            }
        }
        throw new DecryptionException("No configured key opens envelope with keyId=" + envelope.keyId());
    }
}
