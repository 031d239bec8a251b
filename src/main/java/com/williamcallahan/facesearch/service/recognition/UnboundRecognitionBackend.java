package com.williamcallahan.facesearch.service.recognition;

import com.williamcallahan.facesearch.domain.ExtractionOutcome;
import com.williamcallahan.facesearch.domain.FailureCategory;
import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.ProviderCredentials;
import com.williamcallahan.facesearch.domain.ProviderType;
import com.williamcallahan.facesearch.domain.SimilarityScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provider type whose vendor client is not installed.
 *
 * <p>Validates credentials so misconfiguration is reported distinctly, then reports every call as
 * {@link FailureCategory#UNSUPPORTED_PROVIDER}. Records produced under it stay pending until a
 * real binding replaces the subclass.</p>
 */
abstract class UnboundRecognitionBackend implements RecognitionBackend {
    private static final Logger log = LoggerFactory.getLogger(UnboundRecognitionBackend.class);

    private final ProviderType providerType;
    private final Class<? extends ProviderCredentials> credentialsType;

    UnboundRecognitionBackend(ProviderType providerType, Class<? extends ProviderCredentials> credentialsType) {
        this.providerType = providerType;
        this.credentialsType = credentialsType;
    }

    @Override
    public ProviderType providerType() {
        return providerType;
    }

    @Override
    public ExtractionOutcome extract(ProviderConfig provider, ImageSource image) {
        FailureCategory category = unavailableCategory(provider);
        return ExtractionOutcome.unavailable(category, describe(provider, category));
    }

    @Override
    public SimilarityScore compare(
            ProviderConfig provider, String descriptorA, String descriptorB, ImageSource imageB) {
        return SimilarityScore.failed(unavailableCategory(provider));
    }

    private FailureCategory unavailableCategory(ProviderConfig provider) {
        ProviderCredentials credentials = provider.credentials();
        if (!credentialsType.isInstance(credentials) || !credentials.isComplete()) {
            return FailureCategory.MISCONFIGURED;
        }
        log.debug("[FACE-PROVIDER] No {} client installed for provider {}", providerType.value(), provider.id());
        return FailureCategory.UNSUPPORTED_PROVIDER;
    }

    private String describe(ProviderConfig provider, FailureCategory category) {
        if (category == FailureCategory.MISCONFIGURED) {
            return "Provider " + provider.id() + " is missing " + providerType.value() + " credentials";
        }
        return "No " + providerType.value() + " client is installed";
    }
}
