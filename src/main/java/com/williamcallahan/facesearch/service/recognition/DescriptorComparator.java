package com.williamcallahan.facesearch.service.recognition;

import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.SimilarityScore;

/**
 * Scores how likely two descriptors of the same provider type show the same face.
 */
public interface DescriptorComparator {

    /**
     * Compares two descriptors.
     *
     * @param provider active provider configuration
     * @param descriptorA query descriptor
     * @param descriptorB candidate descriptor
     * @param imageB candidate image, or null; backends may detect from it when {@code descriptorB} is missing
     *     or send it along as extra context
     * @return score in [0,1]; failures score 0.0 and carry their category
     */
    SimilarityScore compare(ProviderConfig provider, String descriptorA, String descriptorB, ImageSource imageB);
}
