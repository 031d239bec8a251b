package com.williamcallahan.facesearch.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.facesearch.config.AppProperties;
import com.williamcallahan.facesearch.domain.CandidateEntity;
import com.williamcallahan.facesearch.domain.DescriptorRecord;
import com.williamcallahan.facesearch.domain.DescriptorStatus;
import com.williamcallahan.facesearch.domain.ExtractionOutcome;
import com.williamcallahan.facesearch.domain.FailureCategory;
import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.domain.MatchResult;
import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.ProviderCredentials;
import com.williamcallahan.facesearch.domain.ProviderType;
import com.williamcallahan.facesearch.domain.SimilarityScore;
import com.williamcallahan.facesearch.service.recognition.RecognitionBackends;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies ranking, thresholding and descriptor reuse of face search.
 */
class MatchSearchServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final ImageSource QUERY =
            new ImageSource.InlineImage("query-photo".getBytes(StandardCharsets.UTF_8), "image/jpeg");
    private static final ProviderConfig PROVIDER = new ProviderConfig(
            "local", "Local", ProviderType.LOCAL_FALLBACK, true, true, new ProviderCredentials.None(), 0.5, 2);

    private final ProviderRegistry providerRegistry = mock(ProviderRegistry.class);
    private final RecognitionBackends recognitionBackends = mock(RecognitionBackends.class);
    private final CandidateCorpus candidateCorpus = mock(CandidateCorpus.class);
    private final EmbeddingStore embeddingStore = mock(EmbeddingStore.class);
    private final ExecutorService searchExecutor = Executors.newFixedThreadPool(4);
    private final AppProperties appProperties = new AppProperties();
    private final Map<String, DescriptorRecord> storedRecords = new HashMap<>();

    @AfterEach
    void shutdownExecutor() {
        searchExecutor.shutdownNow();
    }

    @Test
    void returnsMatchesAboveThresholdBestFirstLimitedToMaxResults() {
        givenActiveProvider(PROVIDER);
        givenQueryDescriptor("query-descriptor");
        givenCandidatesWithStoredDescriptors(ProviderType.LOCAL_FALLBACK, "rel-1", "rel-2", "rel-3");
        givenScore("rel-1", 0.9);
        givenScore("rel-2", 0.95);
        givenScore("rel-3", 0.3);

        List<MatchResult> matches = searchService().search(QUERY, null);

        assertEquals(List.of("rel-2", "rel-1"), matches.stream().map(MatchResult::entityId).toList());
        assertEquals(0.95, matches.get(0).similarity());
        assertEquals("Partner rel-2", matches.get(0).partnerName());
        assertEquals("https://photos.example/rel-2.jpg", matches.get(0).facePhotoUrl());
        verify(recognitionBackends, never())
                .extract(eq(PROVIDER), argThat(image -> image instanceof ImageSource.RemoteImage));
    }

    @Test
    void thresholdOverrideReplacesProviderDefault() {
        givenActiveProvider(PROVIDER);
        givenQueryDescriptor("query-descriptor");
        givenCandidatesWithStoredDescriptors(ProviderType.LOCAL_FALLBACK, "rel-1", "rel-2");
        givenScore("rel-1", 0.6);
        givenScore("rel-2", 0.2);

        assertEquals(1, searchService().search(QUERY, null).size());
        assertEquals(2, searchService().search(QUERY, 0.1).size());
        assertTrue(searchService().search(QUERY, 0.99).isEmpty());
    }

    @Test
    void rejectsThresholdOutsideUnitInterval() {
        MatchSearchService searchService = searchService();

        assertThrows(IllegalArgumentException.class, () -> searchService.search(QUERY, 1.5));
        assertThrows(IllegalArgumentException.class, () -> searchService.search(QUERY, -0.1));
        assertThrows(IllegalArgumentException.class, () -> searchService.search(QUERY, Double.NaN));
    }

    @Test
    void equalScoresKeepCorpusOrder() {
        givenActiveProvider(new ProviderConfig(
                "local", "Local", ProviderType.LOCAL_FALLBACK, true, true, new ProviderCredentials.None(), 0.5, 10));
        givenQueryDescriptor("query-descriptor");
        givenCandidatesWithStoredDescriptors(ProviderType.LOCAL_FALLBACK, "rel-1", "rel-2", "rel-3");
        givenScore("rel-1", 0.8);
        givenScore("rel-2", 0.8);
        givenScore("rel-3", 0.8);

        List<MatchResult> matches = searchService().search(QUERY, null);

        assertEquals(List.of("rel-1", "rel-2", "rel-3"), matches.stream().map(MatchResult::entityId).toList());
    }

    @Test
    void queryWithoutFaceFailsBeforeAnyComparison() {
        givenActiveProvider(PROVIDER);
        when(recognitionBackends.extract(PROVIDER, QUERY))
                .thenReturn(ExtractionOutcome.unavailable(FailureCategory.NO_FACE_DETECTED, "no faces"));

        NoFaceDetectedException thrown =
                assertThrows(NoFaceDetectedException.class, () -> searchService().search(QUERY, null));

        assertEquals(FailureCategory.NO_FACE_DETECTED, thrown.category());
        verify(recognitionBackends, never()).compare(any(), anyString(), anyString(), any());
        verify(candidateCorpus, never()).findAllWithPhoto();
    }

    @Test
    void noActiveProviderReturnsNoMatches() {
        when(providerRegistry.getActive()).thenReturn(Optional.empty());

        assertTrue(searchService().search(QUERY, null).isEmpty());
        verify(recognitionBackends, never()).extract(any(), any());
    }

    @Test
    void descriptorFromAnotherProviderIsReextractedAndPersisted() {
        givenActiveProvider(PROVIDER);
        givenQueryDescriptor("query-descriptor");
        givenCandidatesWithStoredDescriptors(ProviderType.CLOUD_B, "rel-1");
        when(recognitionBackends.extract(PROVIDER, candidatePhoto("rel-1")))
                .thenReturn(ExtractionOutcome.extracted("local_fresh"));
        when(recognitionBackends.compare(eq(PROVIDER), eq("query-descriptor"), eq("local_fresh"), any()))
                .thenReturn(SimilarityScore.of(0.9));

        List<MatchResult> matches = searchService().search(QUERY, null);

        assertEquals(1, matches.size());
        verify(embeddingStore).upsert(argThat(stored -> stored.entityId().equals("rel-1")
                && stored.status() == DescriptorStatus.EXTRACTED
                && stored.providerType() == ProviderType.LOCAL_FALLBACK
                && stored.descriptorId().equals("local_fresh")
                && stored.updatedAt().equals(NOW)));
    }

    @Test
    void descriptorOfReplacedPhotoIsReextractedFromTheCurrentPhoto() {
        givenActiveProvider(PROVIDER);
        givenQueryDescriptor("query-descriptor");
        CandidateEntity candidate = candidate("rel-1");
        when(candidateCorpus.findAllWithPhoto()).thenReturn(List.of(candidate));
        when(embeddingStore.findAll(anyCollection())).thenReturn(Map.of("rel-1", DescriptorRecord.extracted(
                candidate, "local_old_face", ProviderType.LOCAL_FALLBACK, "https://photos.example/rel-1-old.jpg", NOW)));
        when(recognitionBackends.extract(PROVIDER, candidatePhoto("rel-1")))
                .thenReturn(ExtractionOutcome.extracted("local_current_face"));
        when(recognitionBackends.compare(eq(PROVIDER), eq("query-descriptor"), eq("local_current_face"), any()))
                .thenReturn(SimilarityScore.of(0.95));

        List<MatchResult> matches = searchService().search(QUERY, null);

        assertEquals(List.of("rel-1"), matches.stream().map(MatchResult::entityId).toList());
        assertEquals(0.95, matches.get(0).similarity());
        verify(recognitionBackends, times(1)).extract(PROVIDER, candidatePhoto("rel-1"));
        verify(recognitionBackends, never()).compare(any(), anyString(), eq("local_old_face"), any());
        verify(embeddingStore).upsert(argThat(stored -> stored.descriptorId().equals("local_current_face")
                && stored.sourcePhotoUrl().equals("https://photos.example/rel-1.jpg")));
    }

    @Test
    void candidatesWithoutDescriptorOrWithFailedComparisonAreSkipped() {
        givenActiveProvider(PROVIDER);
        givenQueryDescriptor("query-descriptor");
        givenCandidatesWithStoredDescriptors(ProviderType.LOCAL_FALLBACK, "rel-1", "rel-2");
        CandidateEntity unregistered = candidate("rel-3");
        when(candidateCorpus.findAllWithPhoto())
                .thenReturn(List.of(candidate("rel-1"), candidate("rel-2"), unregistered));
        when(recognitionBackends.extract(PROVIDER, candidatePhoto("rel-3")))
                .thenReturn(ExtractionOutcome.unavailable(FailureCategory.IMAGE_UNAVAILABLE, "404"));
        givenScore("rel-1", 0.7);
        when(recognitionBackends.compare(eq(PROVIDER), eq("query-descriptor"), eq("local_rel-2"), any()))
                .thenReturn(SimilarityScore.failed(FailureCategory.TIMEOUT));

        List<MatchResult> matches = searchService().search(QUERY, 0.0);

        assertEquals(List.of("rel-1"), matches.stream().map(MatchResult::entityId).toList());
        verify(embeddingStore, never()).upsert(any());
    }

    @Test
    void persistenceFailureAbortsTheSearch() {
        givenActiveProvider(PROVIDER);
        givenQueryDescriptor("query-descriptor");
        when(candidateCorpus.findAllWithPhoto()).thenReturn(List.of(candidate("rel-1")));
        when(embeddingStore.findAll(anyCollection())).thenReturn(Map.of());
        when(recognitionBackends.extract(PROVIDER, candidatePhoto("rel-1")))
                .thenReturn(ExtractionOutcome.extracted("local_fresh"));
        doThrow(new DescriptorPersistenceException("write failed", new IllegalStateException("db")))
                .when(embeddingStore)
                .upsert(any());

        assertThrows(DescriptorPersistenceException.class, () -> searchService().search(QUERY, null));
    }

    private MatchSearchService searchService() {
        return new MatchSearchService(
                providerRegistry,
                recognitionBackends,
                candidateCorpus,
                embeddingStore,
                new PhotoUrlResolver(appProperties),
                searchExecutor,
                Clock.fixed(NOW, ZoneOffset.UTC),
                appProperties);
    }

    private void givenActiveProvider(ProviderConfig provider) {
        when(providerRegistry.getActive()).thenReturn(Optional.of(provider));
        when(recognitionBackends.descriptorValidity(provider.providerType())).thenReturn(Optional.empty());
    }

    private void givenQueryDescriptor(String descriptorId) {
        when(recognitionBackends.extract(any(), eq(QUERY))).thenReturn(ExtractionOutcome.extracted(descriptorId));
    }

    private void givenCandidatesWithStoredDescriptors(ProviderType storedType, String... entityIds) {
        List<CandidateEntity> candidates = new ArrayList<>();
        for (String entityId : entityIds) {
            CandidateEntity candidate = candidate(entityId);
            candidates.add(candidate);
            String descriptorId = storedType == ProviderType.LOCAL_FALLBACK ? "local_" + entityId : "face-" + entityId;
            storedRecords.put(entityId, DescriptorRecord.extracted(
                    candidate, descriptorId, storedType, candidatePhoto(entityId).url().toString(), NOW));
        }
        when(candidateCorpus.findAllWithPhoto()).thenReturn(List.copyOf(candidates));
        when(embeddingStore.findAll(anyCollection())).thenReturn(storedRecords);
    }

    private void givenScore(String entityId, double score) {
        when(recognitionBackends.compare(any(), eq("query-descriptor"), eq("local_" + entityId), any()))
                .thenReturn(SimilarityScore.of(score));
    }

    private static CandidateEntity candidate(String entityId) {
        return new CandidateEntity(
                entityId,
                "https://photos.example/" + entityId + ".jpg",
                "Partner " + entityId,
                "555-0100",
                null,
                "dating",
                "verified",
                "owner-1",
                "Owner",
                "555-0199");
    }

    private static ImageSource.RemoteImage candidatePhoto(String entityId) {
        return new ImageSource.RemoteImage(URI.create("https://photos.example/" + entityId + ".jpg"));
    }
}
