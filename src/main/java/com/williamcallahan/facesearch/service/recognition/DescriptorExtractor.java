package com.williamcallahan.facesearch.service.recognition;

import com.williamcallahan.facesearch.domain.ExtractionOutcome;
import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.domain.ProviderConfig;

/**
 * Produces an opaque face descriptor for an image under a provider configuration.
 */
public interface DescriptorExtractor {

    /**
     * Extracts a descriptor from the image.
     *
     * <p>Backend failures are reported through {@link ExtractionOutcome.Unavailable}; this method
     * does not throw for them and never mutates persisted state.</p>
     *
     * @param provider active provider configuration
     * @param image image to analyze
     * @return extracted descriptor or a classified failure
     */
    ExtractionOutcome extract(ProviderConfig provider, ImageSource image);
}
