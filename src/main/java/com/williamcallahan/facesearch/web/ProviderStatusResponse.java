package com.williamcallahan.facesearch.web;

import com.williamcallahan.facesearch.domain.ProviderStatus;

/**
 * Availability of face search.
 *
 * @param status fixed "success"
 * @param available whether an active and enabled provider exists
 * @param providerId active provider id, null when unavailable
 * @param providerType active provider type, null when unavailable
 * @param similarityThreshold default threshold, null when unavailable
 * @param maxResults result cap, null when unavailable
 */
public record ProviderStatusResponse(
        String status,
        boolean available,
        String providerId,
        String providerType,
        Double similarityThreshold,
        Integer maxResults)
        implements ApiResponse {

    public static ProviderStatusResponse from(ProviderStatus providerStatus) {
        return new ProviderStatusResponse(
                "success",
                providerStatus.available(),
                providerStatus.providerId(),
                providerStatus.providerType(),
                providerStatus.similarityThreshold(),
                providerStatus.maxResults());
    }
}
