package com.williamcallahan.facesearch.service;

import com.williamcallahan.facesearch.domain.CandidateEntity;
import com.williamcallahan.facesearch.domain.DescriptorRecord;
import com.williamcallahan.facesearch.domain.ExtractionOutcome;
import com.williamcallahan.facesearch.domain.FailureCategory;
import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.RegistrationOutcome;
import com.williamcallahan.facesearch.service.recognition.RecognitionBackends;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Extracts and stores the descriptor of one registered partner photo.
 *
 * <p>A failed extraction is stored as a {@code pending} placeholder so the next regeneration run
 * picks the photo up again.</p>
 */
@Service
public class DescriptorRegistrationService {
    private static final Logger log = LoggerFactory.getLogger(DescriptorRegistrationService.class);

    private final ProviderRegistry providerRegistry;
    private final CandidateCorpus candidateCorpus;
    private final RecognitionBackends recognitionBackends;
    private final EmbeddingStore embeddingStore;
    private final PhotoUrlResolver photoUrlResolver;
    private final Clock clock;

    public DescriptorRegistrationService(
            ProviderRegistry providerRegistry,
            CandidateCorpus candidateCorpus,
            RecognitionBackends recognitionBackends,
            EmbeddingStore embeddingStore,
            PhotoUrlResolver photoUrlResolver,
            Clock clock) {
        this.providerRegistry = Objects.requireNonNull(providerRegistry, "providerRegistry");
        this.candidateCorpus = Objects.requireNonNull(candidateCorpus, "candidateCorpus");
        this.recognitionBackends = Objects.requireNonNull(recognitionBackends, "recognitionBackends");
        this.embeddingStore = Objects.requireNonNull(embeddingStore, "embeddingStore");
        this.photoUrlResolver = Objects.requireNonNull(photoUrlResolver, "photoUrlResolver");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers the photo of an entity with the active provider.
     *
     * @param entityId relationship id
     * @return stored status and, when pending, the failure category
     * @throws IllegalArgumentException when the entity does not exist or has no photo
     * @throws FaceProviderUnavailableException when no provider is active
     * @throws DescriptorPersistenceException when the record cannot be stored
     */
    public RegistrationOutcome register(String entityId) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("Entity id is required");
        }
        CandidateEntity candidate = candidateCorpus
                .findById(entityId)
                .orElseThrow(() -> new IllegalArgumentException("No relationship with a registered photo: " + entityId));
        return register(requireActiveProvider(), candidate);
    }

    /**
     * Registers a candidate photo under a provider resolved by the caller.
     */
    public RegistrationOutcome register(ProviderConfig provider, CandidateEntity candidate) {
        String photoUrl = photoUrlResolver.resolve(candidate.photoReference());
        ExtractionOutcome extraction = extractFrom(provider, photoUrl);

        if (extraction instanceof ExtractionOutcome.Extracted extracted) {
            embeddingStore.upsert(DescriptorRecord.extracted(
                    candidate, extracted.id(), provider.providerType(), photoUrl, clock.instant()));
            log.info("[FACE-EMBEDDING] Stored descriptor for entity {} ({})",
                    candidate.entityId(), provider.providerType().value());
            return RegistrationOutcome.extracted(candidate.entityId());
        }

        ExtractionOutcome.Unavailable unavailable = (ExtractionOutcome.Unavailable) extraction;
        embeddingStore.upsert(DescriptorRecord.pending(candidate, provider.providerType(), photoUrl, clock.instant()));
        log.warn("[FACE-EMBEDDING] Stored pending placeholder for entity {} ({}): {}",
                candidate.entityId(), unavailable.category(), unavailable.detail());
        return RegistrationOutcome.pending(candidate.entityId(), unavailable.category());
    }

    /**
     * Removes the stored descriptor of an entity.
     *
     * @return true when a record existed
     */
    public boolean remove(String entityId) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("Entity id is required");
        }
        boolean removed = embeddingStore.delete(entityId);
        log.info("[FACE-EMBEDDING] Removed descriptor for entity {}: {}", entityId, removed);
        return removed;
    }

    private ExtractionOutcome extractFrom(ProviderConfig provider, String photoUrl) {
        ImageSource image;
        try {
            image = ImageSource.parse(photoUrl);
        } catch (IllegalArgumentException invalidPhoto) {
            return ExtractionOutcome.unavailable(FailureCategory.IMAGE_UNAVAILABLE, invalidPhoto.getMessage());
        }
        return recognitionBackends.extract(provider, image);
    }

    private ProviderConfig requireActiveProvider() {
        return providerRegistry
                .getActive()
                .orElseThrow(() -> new FaceProviderUnavailableException(
                        "No active face provider is configured; activate one before registering photos"));
    }
}
