package com.williamcallahan.facesearch.service.recognition;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.facesearch.domain.ExtractionOutcome;
import com.williamcallahan.facesearch.domain.FailureCategory;
import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.ProviderCredentials;
import com.williamcallahan.facesearch.domain.ProviderType;
import com.williamcallahan.facesearch.domain.SimilarityScore;
import com.williamcallahan.facesearch.support.ProviderErrorClassifier;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
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
 * Self-hosted recognition endpoint speaking a small JSON protocol.
 *
 * <p>Detect: {@code {"image": base64, "action": "detect", ...extraConfig}} answered with
 * {@code faceId} or {@code face_id}. Compare: {@code {"action": "compare", faceId1, faceId2,
 * targetImage, ...extraConfig}} answered with {@code similarity} or {@code confidence}.</p>
 */
@Component
public class CustomHttpRecognitionBackend implements RecognitionBackend {
    private static final Logger log = LoggerFactory.getLogger(CustomHttpRecognitionBackend.class);

    private final RestTemplate restTemplate;
    private final ImageLoader imageLoader;

    public CustomHttpRecognitionBackend(RestTemplate restTemplate, ImageLoader imageLoader) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.imageLoader = Objects.requireNonNull(imageLoader, "imageLoader");
    }

    @Override
    public ProviderType providerType() {
        return ProviderType.CUSTOM_HTTP;
    }

    @Override
    public ExtractionOutcome extract(ProviderConfig provider, ImageSource image) {
        try {
            ProviderCredentials.HttpEndpoint credentials = requireCredentials(provider);
            Map<String, Object> detectRequest = new LinkedHashMap<>();
            detectRequest.put("image", imageLoader.loadBase64(image));
            detectRequest.put("action", "detect");
            detectRequest.putAll(credentials.extraConfig());

            JsonNode detection = post(credentials, detectRequest);
            String faceId = firstText(detection, "faceId", "face_id");
            if (faceId == null) {
                return ExtractionOutcome.unavailable(
                        FailureCategory.NO_FACE_DETECTED, "Recognition endpoint returned no face id");
            }
            return ExtractionOutcome.extracted(faceId);
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
            ProviderCredentials.HttpEndpoint credentials = requireCredentials(provider);
            Map<String, Object> compareRequest = new LinkedHashMap<>();
            compareRequest.put("action", "compare");
            compareRequest.put("faceId1", descriptorA);
            compareRequest.put("faceId2", descriptorB);
            if (imageB != null) {
                compareRequest.put("targetImage", targetImageReference(imageB));
            }
            compareRequest.putAll(credentials.extraConfig());

            JsonNode comparison = post(credentials, compareRequest);
            JsonNode score = firstNumber(comparison, "similarity", "confidence");
            if (score == null) {
                log.warn("[FACE-PROVIDER] Compare response from provider {} carried no score", provider.id());
                return SimilarityScore.failed(FailureCategory.PROVIDER_ERROR);
            }
            return SimilarityScore.of(score.asDouble());
        } catch (ProviderRequestException requestFailure) {
            log.warn("[FACE-PROVIDER] Compare failed for provider {} ({}): {}",
                    provider.id(), requestFailure.category(), requestFailure.getMessage());
            return SimilarityScore.failed(requestFailure.category());
        }
    }

    private String targetImageReference(ImageSource imageB) {
        if (imageB instanceof ImageSource.RemoteImage remoteImage) {
            return remoteImage.url().toString();
        }
        return imageLoader.loadBase64(imageB);
    }

    private JsonNode post(ProviderCredentials.HttpEndpoint credentials, Map<String, Object> requestBody) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(credentials.apiKey());
        try {
            JsonNode response =
                    restTemplate.postForObject(credentials.endpoint(), new HttpEntity<>(requestBody, headers), JsonNode.class);
            if (response == null) {
                throw new ProviderRequestException(FailureCategory.PROVIDER_ERROR, "Recognition endpoint returned no body");
            }
            return response;
        } catch (RestClientResponseException responseException) {
            throw new ProviderRequestException(
                    FailureCategory.PROVIDER_ERROR,
                    "Recognition endpoint returned HTTP " + responseException.getStatusCode().value() + ": "
                            + ProviderErrorClassifier.sanitize(responseException.getResponseBodyAsString()),
                    responseException);
        } catch (RestClientException transportException) {
            throw new ProviderRequestException(
                    ProviderErrorClassifier.classify(transportException),
                    "Recognition endpoint request failed: "
                            + ProviderErrorClassifier.sanitize(transportException.getMessage()),
                    transportException);
        }
    }

    private static String firstText(JsonNode node, String... fieldNames) {
        for (String fieldName : fieldNames) {
            JsonNode field = node.get(fieldName);
            if (field != null && field.isValueNode() && !field.asText().isBlank()) {
                return field.asText();
            }
        }
        return null;
    }

    private static JsonNode firstNumber(JsonNode node, String... fieldNames) {
        for (String fieldName : fieldNames) {
            JsonNode field = node.get(fieldName);
            if (field != null && field.isNumber()) {
                return field;
            }
        }
        return null;
    }

    private static ProviderCredentials.HttpEndpoint requireCredentials(ProviderConfig provider) {
        if (provider.credentials() instanceof ProviderCredentials.HttpEndpoint httpEndpoint && httpEndpoint.isComplete()) {
            return httpEndpoint;
        }
        throw new ProviderRequestException(
                FailureCategory.MISCONFIGURED, "Provider " + provider.id() + " is missing endpoint or API key");
    }
}
