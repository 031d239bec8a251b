package com.williamcallahan.facesearch.domain;

import java.util.Optional;

/**
 * Availability of the face search feature, exposed so callers can disambiguate empty results.
 *
 * @param available whether an active and enabled provider exists
 * @param providerId active provider id
 * @param providerType active provider type discriminant
 * @param similarityThreshold default threshold of the active provider
 * @param maxResults result cap of the active provider
 */
public record ProviderStatus(
        boolean available, String providerId, String providerType, Double similarityThreshold, Integer maxResults) {

    /**
     * Describes the given active provider, or the unavailable state when empty.
     */
    public static ProviderStatus from(Optional<ProviderConfig> activeProvider) {
        return activeProvider
                .map(provider -> new ProviderStatus(
                        true,
                        provider.id(),
                        provider.providerType().value(),
                        provider.similarityThreshold(),
                        provider.maxResults()))
                .orElseGet(() -> new ProviderStatus(false, null, null, null, null));
    }
}
