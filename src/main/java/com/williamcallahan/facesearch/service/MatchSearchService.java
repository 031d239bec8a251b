package com.williamcallahan.facesearch.service;

import com.williamcallahan.facesearch.config.AppProperties;
import com.williamcallahan.facesearch.domain.CandidateEntity;
import com.williamcallahan.facesearch.domain.DescriptorRecord;
import com.williamcallahan.facesearch.domain.ExtractionOutcome;
import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.domain.MatchResult;
import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.SimilarityScore;
import com.williamcallahan.facesearch.service.recognition.RecognitionBackends;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Finds registered entities whose face matches a query photo.
 *
 * <p>Results are ordered by similarity, highest first; equal scores keep the corpus order.
 * An empty list means either "no match" or "no active provider"; callers that need to tell them
 * apart check the provider status.</p>
 */
@Service
public class MatchSearchService {
    private static final Logger log = LoggerFactory.getLogger(MatchSearchService.class);

    private final ProviderRegistry providerRegistry;
    private final RecognitionBackends recognitionBackends;
    private final CandidateCorpus candidateCorpus;
    private final EmbeddingStore embeddingStore;
    private final PhotoUrlResolver photoUrlResolver;
    private final ExecutorService searchExecutor;
    private final Clock clock;
    private final Duration candidateTimeout;
    private final boolean persistRefreshedDescriptors;

    public MatchSearchService(
            ProviderRegistry providerRegistry,
            RecognitionBackends recognitionBackends,
            CandidateCorpus candidateCorpus,
            EmbeddingStore embeddingStore,
            PhotoUrlResolver photoUrlResolver,
            @Qualifier("faceSearchExecutor") ExecutorService searchExecutor,
            Clock clock,
            AppProperties appProperties) {
        this.providerRegistry = Objects.requireNonNull(providerRegistry, "providerRegistry");
        this.recognitionBackends = Objects.requireNonNull(recognitionBackends, "recognitionBackends");
        this.candidateCorpus = Objects.requireNonNull(candidateCorpus, "candidateCorpus");
        this.embeddingStore = Objects.requireNonNull(embeddingStore, "embeddingStore");
        this.photoUrlResolver = Objects.requireNonNull(photoUrlResolver, "photoUrlResolver");
        this.searchExecutor = Objects.requireNonNull(searchExecutor, "searchExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.candidateTimeout = appProperties.getSearch().getCandidateTimeout();
        this.persistRefreshedDescriptors = appProperties.getSearch().isPersistRefreshedDescriptors();
    }

    /**
     * Searches the corpus for faces matching the query image.
     *
     * @param query query image
     * @param thresholdOverride minimum similarity, or null to use the provider default
     * @return matches at or above the threshold, best first, at most the provider's max results
     * @throws NoFaceDetectedException when no descriptor can be extracted from the query
     * @throws IllegalArgumentException when the threshold override is outside [0,1]
     * @throws DescriptorPersistenceException when the corpus descriptors cannot be read or refreshed
     */
    public List<MatchResult> search(ImageSource query, Double thresholdOverride) {
        Objects.requireNonNull(query, "query");
        if (thresholdOverride != null && (thresholdOverride < 0.0 || thresholdOverride > 1.0 || thresholdOverride.isNaN())) {
            throw new IllegalArgumentException("threshold must be within [0,1]: " + thresholdOverride);
        }
        Optional<ProviderConfig> activeProvider = providerRegistry.getActive();
        if (activeProvider.isEmpty()) {
            log.info("[FACE-SEARCH] No active provider; returning no matches");
            return List.of();
        }
        ProviderConfig provider = activeProvider.get();
        double threshold = thresholdOverride != null ? thresholdOverride : provider.similarityThreshold();

        ExtractionOutcome queryExtraction = recognitionBackends.extract(provider, query);
        if (!(queryExtraction instanceof ExtractionOutcome.Extracted queryDescriptor)) {
            ExtractionOutcome.Unavailable unavailable = (ExtractionOutcome.Unavailable) queryExtraction;
            throw new NoFaceDetectedException(unavailable.category(), unavailable.detail());
        }

        List<CandidateEntity> candidates = candidateCorpus.findAllWithPhoto();
        if (candidates.isEmpty()) {
            return List.of();
        }
        Map<String, DescriptorRecord> storedRecords =
                embeddingStore.findAll(candidates.stream().map(CandidateEntity::entityId).toList());
        CandidateScoring scoring = new CandidateScoring(
                provider, queryDescriptor.id(), threshold,
                recognitionBackends.descriptorValidity(provider.providerType()), clock.instant());

        List<Future<Optional<MatchResult>>> pendingScores = new ArrayList<>(candidates.size());
        for (CandidateEntity candidate : candidates) {
            DescriptorRecord storedRecord = storedRecords.get(candidate.entityId());
            pendingScores.add(searchExecutor.submit(() -> scoring.score(candidate, storedRecord)));
        }

        List<MatchResult> matches = collectMatches(candidates, pendingScores);
        matches.sort(Comparator.comparingDouble(MatchResult::similarity).reversed());
        List<MatchResult> limited = matches.size() > provider.maxResults()
                ? List.copyOf(matches.subList(0, provider.maxResults()))
                : List.copyOf(matches);
        log.info("[FACE-SEARCH] {} of {} candidates matched at threshold {} (returning {})",
                matches.size(), candidates.size(), threshold, limited.size());
        return limited;
    }

    private List<MatchResult> collectMatches(
            List<CandidateEntity> candidates, List<Future<Optional<MatchResult>>> pendingScores) {
        List<MatchResult> matches = new ArrayList<>();
        for (int candidateIndex = 0; candidateIndex < pendingScores.size(); candidateIndex++) {
            Future<Optional<MatchResult>> pendingScore = pendingScores.get(candidateIndex);
            String entityId = candidates.get(candidateIndex).entityId();
            try {
                pendingScore.get(candidateTimeout.toMillis(), TimeUnit.MILLISECONDS).ifPresent(matches::add);
            } catch (TimeoutException timeout) {
                pendingScore.cancel(true);
                log.warn("[FACE-SEARCH] Candidate {} timed out after {}; skipping", entityId, candidateTimeout);
            } catch (ExecutionException failure) {
                if (failure.getCause() instanceof DescriptorPersistenceException persistenceFailure) {
                    cancelRemaining(pendingScores, candidateIndex + 1);
                    throw persistenceFailure;
                }
                log.warn("[FACE-SEARCH] Candidate {} failed; skipping", entityId, failure.getCause());
            } catch (InterruptedException interrupted) {
                cancelRemaining(pendingScores, candidateIndex);
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Face search interrupted", interrupted);
            }
        }
        return matches;
    }

    private static void cancelRemaining(List<Future<Optional<MatchResult>>> pendingScores, int fromIndex) {
        for (int remainingIndex = fromIndex; remainingIndex < pendingScores.size(); remainingIndex++) {
            pendingScores.get(remainingIndex).cancel(true);
        }
    }

    /**
     * Per-search state shared by the candidate tasks.
     */
    private final class CandidateScoring {
        private final ProviderConfig provider;
        private final String queryDescriptor;
        private final double threshold;
        private final Optional<Duration> descriptorValidity;
        private final Instant searchStartedAt;

        private CandidateScoring(
                ProviderConfig provider,
                String queryDescriptor,
                double threshold,
                Optional<Duration> descriptorValidity,
                Instant searchStartedAt) {
            this.provider = provider;
            this.queryDescriptor = queryDescriptor;
            this.threshold = threshold;
            this.descriptorValidity = descriptorValidity;
            this.searchStartedAt = searchStartedAt;
        }

        Optional<MatchResult> score(CandidateEntity candidate, DescriptorRecord storedRecord) {
            String photoUrl = photoUrlResolver.resolve(candidate.photoReference());
            ImageSource candidateImage;
            try {
                candidateImage = ImageSource.parse(photoUrl);
            } catch (IllegalArgumentException invalidPhoto) {
                log.debug("[FACE-SEARCH] Candidate {} has an unusable photo reference: {}",
                        candidate.entityId(), invalidPhoto.getMessage());
                return Optional.empty();
            }

            Optional<String> candidateDescriptor = storedRecord == null
                    ? Optional.empty()
                    : storedRecord.reusableDescriptor(
                            provider.providerType(), photoUrl, descriptorValidity, searchStartedAt);
            if (candidateDescriptor.isEmpty()) {
                candidateDescriptor = refreshDescriptor(candidate, candidateImage, photoUrl);
            }
            if (candidateDescriptor.isEmpty()) {
                return Optional.empty();
            }

            SimilarityScore similarity =
                    recognitionBackends.compare(provider, queryDescriptor, candidateDescriptor.get(), candidateImage);
            if (!similarity.isMeasured()) {
                log.debug("[FACE-SEARCH] Comparison with candidate {} failed: {}",
                        candidate.entityId(), similarity.failure().orElseThrow());
                return Optional.empty();
            }
            if (similarity.score() < threshold) {
                return Optional.empty();
            }
            return Optional.of(MatchResult.of(candidate, photoUrl, similarity.score()));
        }

        private Optional<String> refreshDescriptor(CandidateEntity candidate, ImageSource candidateImage, String photoUrl) {
            ExtractionOutcome extraction = recognitionBackends.extract(provider, candidateImage);
            if (!(extraction instanceof ExtractionOutcome.Extracted extracted)) {
                log.debug("[FACE-SEARCH] Skipping candidate {}: descriptor unavailable", candidate.entityId());
                return Optional.empty();
            }
            if (persistRefreshedDescriptors) {
                embeddingStore.upsert(DescriptorRecord.extracted(
                        candidate, extracted.id(), provider.providerType(), photoUrl, clock.instant()));
            }
            return Optional.of(extracted.id());
        }
    }
}
