package com.property.reconciliation.health;

import com.property.reconciliation.crypto.DecryptionException;
import com.property.reconciliation.crypto.FieldCodec;

import java.util.Objects;

/**
 * Seals and reopens a fixed sample value to prove the configured key works.
 */
public class CodecHealthCheck implements HealthCheck {

    private static final String SAMPLE = "health-check-sample";

    private final FieldCodec codec;

    public CodecHealthCheck(FieldCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec is required");
    }

    @Override
    public String getName() {
        return "addressCodec";
    }

    @Override
    public HealthStatus check() {
        try {
            String reopened = codec.decrypt(codec.encrypt(SAMPLE));
            if (!SAMPLE.equals(reopened)) {
                return HealthStatus.down("Codec round trip returned a different value");
            }
            return HealthStatus.up();
        } catch (DecryptionException | IllegalStateException e) {
            return HealthStatus.down("Codec round trip failed: " + e.getMessage());
        }
    }
}
