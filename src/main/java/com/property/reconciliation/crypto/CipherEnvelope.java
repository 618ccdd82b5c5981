package com.property.reconciliation.crypto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serialized form of an encrypted field: key id, IV and ciphertext (with GCM tag), all Base64.
 * Stored as compact JSON, e.g. {@code {"kid":"...","iv":"...","ct":"..."}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record CipherEnvelope(
        @JsonProperty("kid") String keyId,
        @JsonProperty("iv") String iv,
        @JsonProperty("ct") String ciphertext
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cipher envelope", e);
        }
    }

    /**
     * @throws DecryptionException if the text is not a complete envelope
     */
    static CipherEnvelope parse(String json) {
        if (json == null || json.isBlank() || json.charAt(0) != '{') {
            throw new DecryptionException("Ciphertext is not an encrypted envelope");
        }
        CipherEnvelope envelope;
        try {
            envelope = MAPPER.readValue(json, CipherEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new DecryptionException("Ciphertext envelope is malformed");
        }
        if (envelope.iv() == null || envelope.ciphertext() == null) {
            throw new DecryptionException("Ciphertext envelope is incomplete");
        }
        return envelope;
    }
}
