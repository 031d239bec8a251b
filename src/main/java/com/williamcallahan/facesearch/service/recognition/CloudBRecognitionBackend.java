package com.williamcallahan.facesearch.service.recognition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.facesearch.domain.ExtractionOutcome;
import com.williamcallahan.facesearch.domain.FailureCategory;
import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.ProviderCredentials;
import com.williamcallahan.facesearch.domain.ProviderType;
import com.williamcallahan.facesearch.domain.SimilarityScore;
import com.williamcallahan.facesearch.support.ProviderErrorClassifier;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Subscription-key face API with separate detect and verify endpoints.
 *
 * <p>Detected face ids are short-lived on the vendor side, so they are only reused within
 * {@link #descriptorValidity()}. Callers re-extract older ids before comparing; the candidate image
 * is detected here only when no candidate face id is supplied.</p>
 */
@Component
public class CloudBRecognitionBackend implements RecognitionBackend {
    private static final Logger log = LoggerFactory.getLogger(CloudBRecognitionBackend.class);

    static final String DETECT_PATH = "/face/v1.0/detect?returnFaceId=true";
    static final String VERIFY_PATH = "/face/v1.0/verify";
    static final String SUBSCRIPTION_KEY_HEADER = "Ocp-Apim-Subscription-Key";
    static final String UNSUPPORTED_FEATURE_CODE = "UnsupportedFeature";
    static final double IDENTICAL_FALLBACK_SCORE = 0.8;
    static final double DIFFERENT_FALLBACK_SCORE = 0.2;
    private static final Duration DESCRIPTOR_VALIDITY = Duration.ofHours(24);

    private final RestTemplate restTemplate;
    private final ImageLoader imageLoader;
    private final ObjectMapper objectMapper;

    /**
     * Creates the backend.
     *
     * @param restTemplate RestTemplate configured with connect and read timeouts
     * @param imageLoader loader for remote and inline images
     * @param objectMapper mapper used to inspect vendor error bodies
     */
    public CloudBRecognitionBackend(RestTemplate restTemplate, ImageLoader imageLoader, ObjectMapper objectMapper) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.imageLoader = Objects.requireNonNull(imageLoader, "imageLoader");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public ProviderType providerType() {
        return ProviderType.CLOUD_B;
    }

    @Override
    public Optional<Duration> descriptorValidity() {
        return Optional.of(DESCRIPTOR_VALIDITY);
    }

    @Override
    public ExtractionOutcome extract(ProviderConfig provider, ImageSource image) {
        try {
            return ExtractionOutcome.extracted(detect(requireCredentials(provider), image));
        } catch (ProviderRequestException requestFailure) {
            log.warn("[FACE-PROVIDER] Detect failed for provider {} ({}): {}",
                    provider.id(), requestFailure.category(), requestFailure.getMessage());
            return ExtractionOutcome.unavailable(requestFailure.category(), requestFailure.getMessage());
        }
    }

    @Override
    public SimilarityScore compare(
            ProviderConfig provider, String descriptorA, String descriptorB, ImageSource imageB) {
        try {
            ProviderCredentials.SubscriptionKey credentials = requireCredentials(provider);
            String candidateFaceId = hasDescriptor(descriptorB) || imageB == null
                    ? descriptorB
                    : detect(credentials, imageB);
            if (!hasDescriptor(candidateFaceId)) {
                return SimilarityScore.failed(FailureCategory.PROVIDER_ERROR);
            }
            return verify(credentials, descriptorA, candidateFaceId);
        } catch (ProviderRequestException requestFailure) {
            log.warn("[FACE-PROVIDER] Verify failed for provider {} ({}): {}",
                    provider.id(), requestFailure.category(), requestFailure.getMessage());
            return SimilarityScore.failed(requestFailure.category());
        }
    }

    private String detect(ProviderCredentials.SubscriptionKey credentials, ImageSource image) {
        byte[] imageBytes = imageLoader.load(image);
        HttpHeaders headers = subscriptionHeaders(credentials);
        headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        JsonNode detectedFaces = post(baseUrl(credentials) + DETECT_PATH, new HttpEntity<>(imageBytes, headers));
        if (detectedFaces == null || !detectedFaces.isArray() || detectedFaces.isEmpty()) {
            throw new ProviderRequestException(FailureCategory.NO_FACE_DETECTED, "Detect returned no faces");
        }
        String faceId = detectedFaces.get(0).path("faceId").asText("");
        if (faceId.isBlank()) {
            throw new ProviderRequestException(FailureCategory.NO_FACE_DETECTED, "Detect returned a face without an id");
        }
        return faceId;
    }

    private SimilarityScore verify(
            ProviderCredentials.SubscriptionKey credentials, String queryFaceId, String candidateFaceId) {
        HttpHeaders headers = subscriptionHeaders(credentials);
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, String> verifyRequest = Map.of("faceId1", queryFaceId, "faceId2", candidateFaceId);
        JsonNode verification = post(baseUrl(credentials) + VERIFY_PATH, new HttpEntity<>(verifyRequest, headers));
        if (verification == null) {
            throw new ProviderRequestException(FailureCategory.PROVIDER_ERROR, "Verify response was empty");
        }
        JsonNode confidence = verification.get("confidence");
        if (confidence != null && confidence.isNumber()) {
            return SimilarityScore.of(confidence.asDouble());
        }
        return SimilarityScore.of(
                verification.path("isIdentical").asBoolean(false) ? IDENTICAL_FALLBACK_SCORE : DIFFERENT_FALLBACK_SCORE);
    }

    private JsonNode post(String url, HttpEntity<?> requestEntity) {
        try {
            return restTemplate.postForObject(url, requestEntity, JsonNode.class);
        } catch (RestClientResponseException responseException) {
            throw new ProviderRequestException(
                    classifyErrorBody(responseException.getResponseBodyAsString()),
                    "Face API returned HTTP " + responseException.getStatusCode().value() + ": "
                            + ProviderErrorClassifier.sanitize(responseException.getResponseBodyAsString()),
                    responseException);
        } catch (RestClientException transportException) {
            throw new ProviderRequestException(
                    ProviderErrorClassifier.classify(transportException),
                    "Face API request failed: " + ProviderErrorClassifier.sanitize(transportException.getMessage()),
                    transportException);
        }
    }

    /**
     * Maps the vendor's {@code error.innererror.code} to a failure category.
     */
    FailureCategory classifyErrorBody(String errorBody) {
        if (errorBody == null || errorBody.isBlank()) {
            return FailureCategory.PROVIDER_ERROR;
        }
        try {
            JsonNode errorNode = objectMapper.readTree(errorBody);
            String innerCode = errorNode.path("error").path("innererror").path("code").asText("");
            if (UNSUPPORTED_FEATURE_CODE.equals(innerCode)) {
                return FailureCategory.AUTHORIZATION_REQUIRED;
            }
        } catch (JsonProcessingException parseException) {
            log.debug("[FACE-PROVIDER] Face API error body was not JSON: {}", parseException.getOriginalMessage());
        }
        return FailureCategory.PROVIDER_ERROR;
    }

    private static boolean hasDescriptor(String faceId) {
        return faceId != null && !faceId.isBlank();
    }

    private static HttpHeaders subscriptionHeaders(ProviderCredentials.SubscriptionKey credentials) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(SUBSCRIPTION_KEY_HEADER, credentials.subscriptionKey());
        return headers;
    }

    private static String baseUrl(ProviderCredentials.SubscriptionKey credentials) {
        String endpoint = credentials.endpoint().trim();
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }

    private static ProviderCredentials.SubscriptionKey requireCredentials(ProviderConfig provider) {
        if (provider.credentials() instanceof ProviderCredentials.SubscriptionKey subscriptionKey
                && subscriptionKey.isComplete()) {
            return subscriptionKey;
        }
        throw new ProviderRequestException(
                FailureCategory.MISCONFIGURED, "Provider " + provider.id() + " is missing endpoint or subscription key");
    }
}
