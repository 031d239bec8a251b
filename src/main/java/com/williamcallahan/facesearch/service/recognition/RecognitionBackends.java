package com.williamcallahan.facesearch.service.recognition;

import com.williamcallahan.facesearch.domain.ExtractionOutcome;
import com.williamcallahan.facesearch.domain.FailureCategory;
import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.ProviderType;
import com.williamcallahan.facesearch.domain.SimilarityScore;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Routes extraction and comparison to the backend registered for the provider's type.
 */
@Service
public class RecognitionBackends implements DescriptorExtractor, DescriptorComparator {
    private static final Logger log = LoggerFactory.getLogger(RecognitionBackends.class);

    private final Map<ProviderType, RecognitionBackend> backendsByType = new EnumMap<>(ProviderType.class);

    /**
     * Indexes the available backends by provider type.
     *
     * @param backends every backend bean in the context
     * @throws IllegalStateException when two backends claim the same provider type
     */
    public RecognitionBackends(List<RecognitionBackend> backends) {
        Objects.requireNonNull(backends, "backends");
        for (RecognitionBackend backend : backends) {
            RecognitionBackend previous = backendsByType.put(backend.providerType(), backend);
            if (previous != null) {
                throw new IllegalStateException("Duplicate recognition backend for " + backend.providerType().value()
                        + ": " + previous.getClass().getSimpleName() + " and " + backend.getClass().getSimpleName());
            }
        }
        log.info("[FACE-PROVIDER] Registered recognition backends: {}", backendsByType.keySet());
    }

    @Override
    public ExtractionOutcome extract(ProviderConfig provider, ImageSource image) {
        Optional<RecognitionBackend> backend = backendFor(provider.providerType());
        if (backend.isEmpty()) {
            return ExtractionOutcome.unavailable(
                    FailureCategory.UNSUPPORTED_PROVIDER, "No backend for " + provider.providerType().value());
        }
        try {
            return backend.get().extract(provider, image);
        } catch (RuntimeException unexpected) {
            log.error("[FACE-PROVIDER] Backend {} failed unexpectedly during extraction",
                    provider.providerType().value(), unexpected);
            return ExtractionOutcome.unavailable(FailureCategory.UNEXPECTED, unexpected.getClass().getSimpleName());
        }
    }

    @Override
    public SimilarityScore compare(
            ProviderConfig provider, String descriptorA, String descriptorB, ImageSource imageB) {
        Optional<RecognitionBackend> backend = backendFor(provider.providerType());
        if (backend.isEmpty()) {
            return SimilarityScore.failed(FailureCategory.UNSUPPORTED_PROVIDER);
        }
        try {
            return backend.get().compare(provider, descriptorA, descriptorB, imageB);
        } catch (RuntimeException unexpected) {
            log.error("[FACE-PROVIDER] Backend {} failed unexpectedly during comparison",
                    provider.providerType().value(), unexpected);
            return SimilarityScore.failed(FailureCategory.UNEXPECTED);
        }
    }

    /**
     * Returns how long descriptors of the given type may be reused, empty when they never expire.
     */
    public Optional<Duration> descriptorValidity(ProviderType providerType) {
        return backendFor(providerType).flatMap(RecognitionBackend::descriptorValidity);
    }

    private Optional<RecognitionBackend> backendFor(ProviderType providerType) {
        return Optional.ofNullable(backendsByType.get(providerType));
    }
}
