package com.property.reconciliation.trust;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.property.reconciliation.core.model.FieldGroup;
import com.property.reconciliation.core.model.FieldProvenance;
import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Per-field authority of each source.
 * Ranks are looked up by the field's {@link FieldGroup}; a higher rank wins and equal ranks
 * fall back to recency. {@link PropertySource#UNKNOWN} is always rank 0.
 *
 * <p>The table is data, loaded from {@code trust-policy.json}:</p>
 * <pre>
 * {
 *   "groups": {
 *     "PRICING_STATUS": {"mode": "OVERRIDE", "ranks": {"LISTING_SYNDICATION": 40, "ADMIN": 30}},
 *     ...
 *   }
 * }
 * </pre>
 */
public final class SourceTrustPolicy {
    private static final Logger log = LoggerFactory.getLogger(SourceTrustPolicy.class);

    public static final String DEFAULT_RESOURCE = "/trust-policy.json";

    private final Map<FieldGroup, Map<PropertySource, Integer>> ranks;
    private final Map<FieldGroup, MergeMode> modes;

    private SourceTrustPolicy(Builder builder) {
        EnumMap<FieldGroup, Map<PropertySource, Integer>> rankCopy = new EnumMap<>(FieldGroup.class);
        builder.ranks.forEach((group, table) -> rankCopy.put(group,
                Collections.unmodifiableMap(new EnumMap<>(table))));
        this.ranks = Collections.unmodifiableMap(rankCopy);
        this.modes = Collections.unmodifiableMap(new EnumMap<>(builder.modes));
    }

    /**
     * Loads the policy shipped on the classpath.
     */
    public static SourceTrustPolicy defaults() {
        try (InputStream in = SourceTrustPolicy.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Trust policy resource not found: " + DEFAULT_RESOURCE);
            }
            return fromJson(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read trust policy " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Parses a policy table.
     *
     * @throws IllegalArgumentException if a group is missing or a rank is negative
     */
    public static SourceTrustPolicy fromJson(InputStream in) throws IOException {
        JsonNode root = new ObjectMapper().readTree(in);
        JsonNode groups = root != null ? root.path("groups") : null;
        if (groups == null || !groups.isObject()) {
            throw new IllegalArgumentException("Trust policy must contain a 'groups' object");
        }

        Builder builder = builder();
        for (FieldGroup group : FieldGroup.values()) {
            JsonNode node = groups.get(group.name());
            if (node == null) {
                throw new IllegalArgumentException("Trust policy is missing group " + group);
            }
            builder.mode(group, MergeMode.valueOf(node.path("mode").asText(MergeMode.OVERRIDE.name())));
            Iterator<Map.Entry<String, JsonNode>> entries = node.path("ranks").fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                builder.rank(group, PropertySource.valueOf(entry.getKey()), entry.getValue().asInt());
            }
        }
        SourceTrustPolicy policy = builder.build();
        log.debug("Trust policy loaded: {}", policy.ranks);
        return policy;
    }

    /**
     * Authority of a source for a field. Missing entries and unknown sources rank 0.
     */
    public int rank(PropertyField field, PropertySource source) {
        if (source == PropertySource.UNKNOWN) {
            return 0;
        }
        Map<PropertySource, Integer> table = ranks.get(field.group());
        if (table == null) {
            return 0;
        }
        return table.getOrDefault(source, 0);
    }

    public MergeMode mergeMode(PropertyField field) {
        return modes.getOrDefault(field.group(), MergeMode.OVERRIDE);
    }

    /**
     * Whether an incoming write may replace the value recorded in {@code current}.
     * Higher rank wins; on equal rank the observation that is not older wins.
     */
    public boolean outranks(PropertyField field, PropertySource incoming, Instant observedAt,
                            FieldProvenance current) {
        Objects.requireNonNull(observedAt, "observedAt is required");
        if (current == null) {
            return true;
        }
        int incomingRank = rank(field, incoming);
        int currentRank = rank(field, current.source());
        if (incomingRank != currentRank) {
            return incomingRank > currentRank;
        }
        return !observedAt.isBefore(current.updatedAt());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<FieldGroup, Map<PropertySource, Integer>> ranks = new EnumMap<>(FieldGroup.class);
        private final Map<FieldGroup, MergeMode> modes = new EnumMap<>(FieldGroup.class);

        public Builder rank(FieldGroup group, PropertySource source, int rank) {
            if (rank < 0) {
                throw new IllegalArgumentException("rank must be >= 0 for " + group + "/" + source);
            }
            ranks.computeIfAbsent(group, g -> new EnumMap<>(PropertySource.class)).put(source, rank);
            return this;
        }

        public Builder mode(FieldGroup group, MergeMode mode) {
            modes.put(group, Objects.requireNonNull(mode, "mode is required"));
            return this;
        }

        public SourceTrustPolicy build() {
            return new SourceTrustPolicy(this);
        }
    }
}
