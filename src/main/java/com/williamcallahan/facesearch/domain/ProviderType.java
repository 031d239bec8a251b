package com.williamcallahan.facesearch.domain;

import java.util.Locale;
import java.util.Map;

/**
 * Identifies the recognition backend family a provider configuration and its descriptors belong to.
 *
 * <p>Descriptors are only comparable when they were produced under the same provider type.</p>
 */
public enum ProviderType {
    /** Access-key authenticated cloud backend. */
    CLOUD_A("cloud_a"),
    /** Subscription-key face API with detect and verify endpoints; descriptor ids expire. */
    CLOUD_B("cloud_b"),
    /** Service-account authenticated cloud backend. */
    CLOUD_C("cloud_c"),
    /** Self-hosted HTTP recognition endpoint. */
    CUSTOM_HTTP("custom_http"),
    /** Dependency-free rolling-hash fallback. */
    LOCAL_FALLBACK("local_fallback");

    private static final Map<String, ProviderType> LEGACY_ALIASES = Map.of(
            "aws_rekognition", CLOUD_A,
            "azure_face", CLOUD_B,
            "google_vision", CLOUD_C,
            "custom", CUSTOM_HTTP,
            "local", LOCAL_FALLBACK);

    private final String value;

    ProviderType(String value) {
        this.value = value;
    }

    /**
     * Returns the discriminant persisted with provider configurations and descriptor records.
     */
    public String value() {
        return value;
    }

    /**
     * Resolves a persisted discriminant, accepting the legacy names of earlier deployments.
     *
     * @param rawValue stored discriminant
     * @return matching provider type
     * @throws IllegalArgumentException when the discriminant is unknown
     */
    public static ProviderType fromValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new IllegalArgumentException("Provider type is required");
        }
        String normalized = rawValue.trim().toLowerCase(Locale.ROOT);
        for (ProviderType providerType : values()) {
            if (providerType.value.equals(normalized)) {
                return providerType;
            }
        }
        ProviderType legacyType = LEGACY_ALIASES.get(normalized);
        if (legacyType != null) {
            return legacyType;
        }
        throw new IllegalArgumentException("Unknown provider type: " + rawValue);
    }
}
