package com.property.reconciliation.crypto;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The current sealing key plus the prior keys still accepted for opening during a rotation window.
 * Read-only after construction and safe to share across threads.
 */
public final class KeyRing {

    private final EncryptionKey current;
    private final List<EncryptionKey> previous;

    public KeyRing(EncryptionKey current, List<EncryptionKey> previous) {
        this.current = Objects.requireNonNull(current, "current key is required");
        this.previous = previous != null ? List.copyOf(previous) : List.of();
    }

    public static KeyRing of(EncryptionKey current) {
        return new KeyRing(current, List.of());
    }

    /**
     * Builds a ring from Base64-encoded keys.
     *
     * @param current  the sealing key
     * @param previous prior keys, newest first; blank entries are ignored
     */
    public static KeyRing fromBase64(String current, List<String> previous) {
        List<EncryptionKey> prior = new ArrayList<>();
        if (previous != null) {
            for (String encoded : previous) {
                if (encoded != null && !encoded.isBlank()) {
                    prior.add(EncryptionKey.fromBase64(encoded));
                }
            }
        }
        return new KeyRing(EncryptionKey.fromBase64(current), prior);
    }

    public EncryptionKey current() {
        return current;
    }

    public List<EncryptionKey> previous() {
        return previous;
    }

    /**
     * Keys to try when opening an envelope: the one whose id matches, then the current key,
     * then prior keys in configured order. Each key appears once.
     */
    List<EncryptionKey> openingOrder(String keyId) {
        Set<EncryptionKey> ordered = new LinkedHashSet<>();
        if (keyId != null) {
            if (current.keyId().equals(keyId)) {
                ordered.add(current);
            }
            for (EncryptionKey key : previous) {
                if (key.keyId().equals(keyId)) {
                    ordered.add(key);
                }
            }
        }
        ordered.add(current);
        ordered.addAll(previous);
        return List.copyOf(ordered);
    }

    public int size() {
        return 1 + previous.size();
    }
}
