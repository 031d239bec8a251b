package com.williamcallahan.facesearch.service.recognition;

import com.williamcallahan.facesearch.domain.ProviderType;
import java.time.Duration;
import java.util.Optional;

/**
 * Extraction and comparison for one provider type.
 */
public interface RecognitionBackend extends DescriptorExtractor, DescriptorComparator {

    /**
     * Returns the provider type this backend serves.
     */
    ProviderType providerType();

    /**
     * Returns how long descriptors produced by this backend can be reused, empty when they never expire.
     */
    default Optional<Duration> descriptorValidity() {
        return Optional.empty();
    }
}
