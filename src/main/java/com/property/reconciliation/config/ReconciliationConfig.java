package com.property.reconciliation.config;

import com.property.reconciliation.api.ReconciliationOptions;
import com.property.reconciliation.crypto.KeyRing;
import com.property.reconciliation.trust.SourceTrustPolicy;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the engine needs from the environment, built once at startup.
 *
 * <ul>
 *   <li>{@code PROPERTY_ADDRESS_KEY}: Base64 32-byte AES key (required)</li>
 *   <li>{@code PROPERTY_ADDRESS_PREVIOUS_KEYS}: comma-separated prior keys, newest first</li>
 *   <li>{@code PROPERTY_RECONCILE_MAX_RETRIES}: default 3</li>
 *   <li>{@code PROPERTY_RECONCILE_TIMEOUT_MS}: default 5000</li>
 *   <li>{@code PROPERTY_STATS_TTL_SECONDS}: default 30</li>
 * </ul>
 */
public record ReconciliationConfig(KeyRing keyRing, SourceTrustPolicy trustPolicy, ReconciliationOptions options) {

    public static final String ADDRESS_KEY = "PROPERTY_ADDRESS_KEY";
    public static final String PREVIOUS_KEYS = "PROPERTY_ADDRESS_PREVIOUS_KEYS";
    public static final String MAX_RETRIES = "PROPERTY_RECONCILE_MAX_RETRIES";
    public static final String TIMEOUT_MS = "PROPERTY_RECONCILE_TIMEOUT_MS";
    public static final String STATS_TTL_SECONDS = "PROPERTY_STATS_TTL_SECONDS";

    public ReconciliationConfig {
        Objects.requireNonNull(keyRing, "keyRing is required");
        Objects.requireNonNull(trustPolicy, "trustPolicy is required");
        Objects.requireNonNull(options, "options is required");
    }

    public static ReconciliationConfig of(KeyRing keyRing) {
        return new ReconciliationConfig(keyRing, SourceTrustPolicy.defaults(), ReconciliationOptions.defaults());
    }

    public static ReconciliationConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * @throws IllegalStateException if the address key is missing or a value is malformed
     */
    public static ReconciliationConfig fromEnvironment(Map<String, String> env) {
        String current = env.get(ADDRESS_KEY);
        if (current == null || current.isBlank()) {
            throw new IllegalStateException(ADDRESS_KEY + " is not set");
        }
        List<String> previous = env.containsKey(PREVIOUS_KEYS)
                ? Arrays.asList(env.get(PREVIOUS_KEYS).split(","))
                : List.of();

        KeyRing keyRing;
        try {
            keyRing = KeyRing.fromBase64(current, previous);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid address key configuration: " + e.getMessage(), e);
        }

        long maxRetries = number(env, MAX_RETRIES, ReconciliationOptions.DEFAULT_MAX_RETRIES);
        if (maxRetries < 0 || maxRetries > Integer.MAX_VALUE) {
            throw new IllegalStateException(MAX_RETRIES + " is out of range, got " + maxRetries);
        }

        ReconciliationOptions options;
        try {
            options = ReconciliationOptions.builder()
                    .maxRetries((int) maxRetries)
                    .timeout(Duration.ofMillis(number(env, TIMEOUT_MS,
                            ReconciliationOptions.DEFAULT_TIMEOUT.toMillis())))
                    .statsTtl(Duration.ofSeconds(number(env, STATS_TTL_SECONDS,
                            ReconciliationOptions.DEFAULT_STATS_TTL.toSeconds())))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid reconcile configuration: " + e.getMessage(), e);
        }
        return new ReconciliationConfig(keyRing, SourceTrustPolicy.defaults(), options);
    }

    private static long number(Map<String, String> env, String name, long fallback) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(name + " must be a number, got '" + raw + "'", e);
        }
    }
}
