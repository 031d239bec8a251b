package com.williamcallahan.facesearch.service.recognition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.williamcallahan.facesearch.domain.ExtractionOutcome;
import com.williamcallahan.facesearch.domain.FailureCategory;
import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.ProviderCredentials;
import com.williamcallahan.facesearch.domain.ProviderType;
import com.williamcallahan.facesearch.domain.SimilarityScore;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Verifies routing by provider type and the failure contract of the backend dispatcher.
 */
class RecognitionBackendsTest {
    private static final ImageSource PHOTO =
            new ImageSource.InlineImage("photo".getBytes(StandardCharsets.UTF_8), "image/jpeg");

    private final RecognitionBackends recognitionBackends =
            new RecognitionBackends(List.of(new CloudARecognitionBackend(), new CloudCRecognitionBackend()));

    @Test
    void unboundBackendWithCompleteCredentialsIsUnsupported() {
        ProviderConfig cloudA = provider(
                ProviderType.CLOUD_A, new ProviderCredentials.AccessKey("AKIA123", "secret", null));

        ExtractionOutcome outcome = recognitionBackends.extract(cloudA, PHOTO);
        SimilarityScore similarity = recognitionBackends.compare(cloudA, "a", "b", PHOTO);

        assertEquals(
                FailureCategory.UNSUPPORTED_PROVIDER,
                assertInstanceOf(ExtractionOutcome.Unavailable.class, outcome).category());
        assertEquals(FailureCategory.UNSUPPORTED_PROVIDER, similarity.failure().orElseThrow());
    }

    @Test
    void unboundBackendWithMismatchedOrIncompleteCredentialsIsMisconfigured() {
        ProviderConfig wrongCredentials = provider(ProviderType.CLOUD_C, new ProviderCredentials.None());
        ProviderConfig incompleteCredentials =
                provider(ProviderType.CLOUD_C, new ProviderCredentials.ServiceAccount("project-1", ""));

        assertEquals(
                FailureCategory.MISCONFIGURED,
                assertInstanceOf(ExtractionOutcome.Unavailable.class, recognitionBackends.extract(wrongCredentials, PHOTO))
                        .category());
        assertEquals(
                FailureCategory.MISCONFIGURED,
                recognitionBackends.compare(incompleteCredentials, "a", "b", null).failure().orElseThrow());
    }

    @Test
    void providerTypeWithoutBackendIsUnsupported() {
        ProviderConfig local = provider(ProviderType.LOCAL_FALLBACK, new ProviderCredentials.None());

        assertEquals(
                FailureCategory.UNSUPPORTED_PROVIDER,
                assertInstanceOf(ExtractionOutcome.Unavailable.class, recognitionBackends.extract(local, PHOTO))
                        .category());
        assertTrue(recognitionBackends.descriptorValidity(ProviderType.LOCAL_FALLBACK).isEmpty());
    }

    @Test
    void unexpectedBackendExceptionBecomesUnexpectedFailure() {
        RecognitionBackend explodingBackend = mock(RecognitionBackend.class);
        when(explodingBackend.providerType()).thenReturn(ProviderType.CUSTOM_HTTP);
        when(explodingBackend.extract(any(), any())).thenThrow(new IllegalStateException("boom"));
        when(explodingBackend.compare(any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));
        when(explodingBackend.descriptorValidity()).thenReturn(Optional.of(Duration.ofMinutes(5)));
        RecognitionBackends dispatcher = new RecognitionBackends(List.of(explodingBackend));
        ProviderConfig custom = provider(
                ProviderType.CUSTOM_HTTP, new ProviderCredentials.HttpEndpoint("http://x", "key", null));

        assertEquals(
                FailureCategory.UNEXPECTED,
                assertInstanceOf(ExtractionOutcome.Unavailable.class, dispatcher.extract(custom, PHOTO)).category());
        assertEquals(FailureCategory.UNEXPECTED, dispatcher.compare(custom, "a", "b", null).failure().orElseThrow());
        assertEquals(Optional.of(Duration.ofMinutes(5)), dispatcher.descriptorValidity(ProviderType.CUSTOM_HTTP));
    }

    @Test
    void rejectsDuplicateBackendsForOneType() {
        assertThrows(
                IllegalStateException.class,
                () -> new RecognitionBackends(List.of(new CloudARecognitionBackend(), new CloudARecognitionBackend())));
    }

    private static ProviderConfig provider(ProviderType providerType, ProviderCredentials credentials) {
        return new ProviderConfig(providerType.value(), null, providerType, true, true, credentials, 0.5, 10);
    }
}
