package com.williamcallahan.facesearch.domain;

import java.util.Objects;

/**
 * Immutable snapshot of one recognition provider configuration.
 *
 * @param id provider identifier
 * @param name display name
 * @param providerType backend family
 * @param active whether the provider is selected
 * @param enabled whether the provider may be used
 * @param credentials backend-specific credentials
 * @param similarityThreshold default match threshold in [0,1]
 * @param maxResults maximum number of search results, at least 1
 */
public record ProviderConfig(
        String id,
        String name,
        ProviderType providerType,
        boolean active,
        boolean enabled,
        ProviderCredentials credentials,
        double similarityThreshold,
        int maxResults) {

    public ProviderConfig {
        Objects.requireNonNull(id, "Provider id is required");
        Objects.requireNonNull(providerType, "Provider type is required");
        Objects.requireNonNull(credentials, "Provider credentials are required");
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0 || Double.isNaN(similarityThreshold)) {
            throw new IllegalArgumentException("similarityThreshold must be within [0,1]: " + similarityThreshold);
        }
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be at least 1: " + maxResults);
        }
        name = name == null ? providerType.value() : name;
    }

    /**
     * Returns true when this provider is both selected and allowed to serve requests.
     */
    public boolean isUsable() {
        return active && enabled;
    }
}
