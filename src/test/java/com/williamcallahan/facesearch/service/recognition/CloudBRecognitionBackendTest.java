package com.williamcallahan.facesearch.service.recognition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.williamcallahan.facesearch.domain.ExtractionOutcome;
import com.williamcallahan.facesearch.domain.FailureCategory;
import com.williamcallahan.facesearch.domain.ImageSource;
import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.ProviderCredentials;
import com.williamcallahan.facesearch.domain.ProviderType;
import com.williamcallahan.facesearch.domain.SimilarityScore;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

/**
 * Verifies the subscription-key face API backend against a local stub of its detect and verify endpoints.
 */
class CloudBRecognitionBackendTest {
    private static final String SUBSCRIPTION_KEY = "test-subscription-key";
    private static final ImageSource PHOTO =
            new ImageSource.InlineImage("jpeg-bytes".getBytes(StandardCharsets.UTF_8), "image/jpeg");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RestTemplate restTemplate = new RestTemplate();
    private final CloudBRecognitionBackend backend =
            new CloudBRecognitionBackend(restTemplate, new ImageLoader(restTemplate), objectMapper);

    @Test
    void detectSendsSubscriptionKeyAndReturnsFirstFaceId() throws IOException {
        ExecutorService serverExecutor = Executors.newSingleThreadExecutor();
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        List<String> observedKeys = new CopyOnWriteArrayList<>();
        List<String> observedQueries = new CopyOnWriteArrayList<>();

        httpServer.createContext("/face/v1.0/detect", exchange -> {
            observedKeys.add(exchange.getRequestHeaders().getFirst("Ocp-Apim-Subscription-Key"));
            observedQueries.add(exchange.getRequestURI().getQuery());
            exchange.getRequestBody().readAllBytes();
            respondJson(exchange, 200, "[{\"faceId\":\"face-abc\"},{\"faceId\":\"face-second\"}]");
        });
        httpServer.setExecutor(serverExecutor);
        httpServer.start();

        try {
            ExtractionOutcome outcome = backend.extract(provider(baseUrl(httpServer) + "/"), PHOTO);

            assertEquals("face-abc", outcome.descriptorId().orElseThrow());
            assertEquals(List.of(SUBSCRIPTION_KEY), observedKeys);
            assertEquals(List.of("returnFaceId=true"), observedQueries);
        } finally {
            httpServer.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void emptyDetectionMeansNoFaceDetected() throws IOException {
        ExecutorService serverExecutor = Executors.newSingleThreadExecutor();
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/face/v1.0/detect", exchange -> respondJson(exchange, 200, "[]"));
        httpServer.setExecutor(serverExecutor);
        httpServer.start();

        try {
            ExtractionOutcome outcome = backend.extract(provider(baseUrl(httpServer)), PHOTO);

            ExtractionOutcome.Unavailable unavailable = assertInstanceOf(ExtractionOutcome.Unavailable.class, outcome);
            assertEquals(FailureCategory.NO_FACE_DETECTED, unavailable.category());
        } finally {
            httpServer.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void unsupportedFeatureErrorMeansAuthorizationRequired() throws IOException {
        ExecutorService serverExecutor = Executors.newSingleThreadExecutor();
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/face/v1.0/detect", exchange -> respondJson(
                exchange,
                403,
                "{\"error\":{\"code\":\"InvalidRequest\",\"message\":\"Feature not approved\","
                        + "\"innererror\":{\"code\":\"UnsupportedFeature\"}}}"));
        httpServer.setExecutor(serverExecutor);
        httpServer.start();

        try {
            ExtractionOutcome outcome = backend.extract(provider(baseUrl(httpServer)), PHOTO);

            ExtractionOutcome.Unavailable unavailable = assertInstanceOf(ExtractionOutcome.Unavailable.class, outcome);
            assertEquals(FailureCategory.AUTHORIZATION_REQUIRED, unavailable.category());
            assertTrue(unavailable.detail().contains("HTTP 403"));
        } finally {
            httpServer.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void compareVerifiesSuppliedCandidateFaceWithoutDetecting() throws IOException {
        ExecutorService serverExecutor = Executors.newSingleThreadExecutor();
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        AtomicInteger detectCalls = new AtomicInteger();
        List<JsonNode> verifyRequests = new CopyOnWriteArrayList<>();

        httpServer.createContext("/face/v1.0/detect", exchange -> {
            detectCalls.incrementAndGet();
            exchange.getRequestBody().readAllBytes();
            respondJson(exchange, 200, "[{\"faceId\":\"redetected-face\"}]");
        });
        httpServer.createContext("/face/v1.0/verify", exchange -> {
            verifyRequests.add(objectMapper.readTree(exchange.getRequestBody().readAllBytes()));
            respondJson(exchange, 200, "{\"isIdentical\":true,\"confidence\":0.87}");
        });
        httpServer.setExecutor(serverExecutor);
        httpServer.start();

        try {
            SimilarityScore similarity =
                    backend.compare(provider(baseUrl(httpServer)), "query-face", "stored-candidate-face", PHOTO);

            assertTrue(similarity.isMeasured());
            assertEquals(0.87, similarity.score());
            assertEquals(0, detectCalls.get());
            assertEquals(1, verifyRequests.size());
            assertEquals("query-face", verifyRequests.get(0).path("faceId1").asText());
            assertEquals("stored-candidate-face", verifyRequests.get(0).path("faceId2").asText());
        } finally {
            httpServer.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void compareDetectsCandidateImageOnceWhenNoFaceIdIsSupplied() throws IOException {
        ExecutorService serverExecutor = Executors.newSingleThreadExecutor();
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        AtomicInteger detectCalls = new AtomicInteger();
        List<JsonNode> verifyRequests = new CopyOnWriteArrayList<>();

        httpServer.createContext("/face/v1.0/detect", exchange -> {
            detectCalls.incrementAndGet();
            exchange.getRequestBody().readAllBytes();
            respondJson(exchange, 200, "[{\"faceId\":\"fresh-candidate-face\"}]");
        });
        httpServer.createContext("/face/v1.0/verify", exchange -> {
            verifyRequests.add(objectMapper.readTree(exchange.getRequestBody().readAllBytes()));
            respondJson(exchange, 200, "{\"isIdentical\":false,\"confidence\":0.31}");
        });
        httpServer.setExecutor(serverExecutor);
        httpServer.start();

        try {
            SimilarityScore similarity = backend.compare(provider(baseUrl(httpServer)), "query-face", null, PHOTO);

            assertEquals(0.31, similarity.score());
            assertEquals(1, detectCalls.get());
            assertEquals("fresh-candidate-face", verifyRequests.get(0).path("faceId2").asText());
        } finally {
            httpServer.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void verifyWithoutConfidenceFallsBackToIdentityFlag() throws IOException {
        ExecutorService serverExecutor = Executors.newSingleThreadExecutor();
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/face/v1.0/verify", exchange -> {
            exchange.getRequestBody().readAllBytes();
            respondJson(exchange, 200, "{\"isIdentical\":true}");
        });
        httpServer.setExecutor(serverExecutor);
        httpServer.start();

        try {
            SimilarityScore similarity = backend.compare(provider(baseUrl(httpServer)), "face-a", "face-b", null);

            assertEquals(CloudBRecognitionBackend.IDENTICAL_FALLBACK_SCORE, similarity.score());
        } finally {
            httpServer.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void missingSubscriptionKeyIsMisconfigured() {
        ProviderConfig incompleteProvider = new ProviderConfig(
                "cloud-b", "Cloud B", ProviderType.CLOUD_B, true, true,
                new ProviderCredentials.SubscriptionKey("http://127.0.0.1:1", " "), 0.6, 5);

        ExtractionOutcome outcome = backend.extract(incompleteProvider, PHOTO);
        SimilarityScore similarity = backend.compare(incompleteProvider, "face-a", "face-b", null);

        assertEquals(FailureCategory.MISCONFIGURED, assertInstanceOf(ExtractionOutcome.Unavailable.class, outcome).category());
        assertEquals(FailureCategory.MISCONFIGURED, similarity.failure().orElseThrow());
        assertEquals(0.0, similarity.score());
    }

    @Test
    void classifiesOnlyUnsupportedFeatureAsAuthorizationRequired() {
        assertEquals(
                FailureCategory.AUTHORIZATION_REQUIRED,
                backend.classifyErrorBody("{\"error\":{\"innererror\":{\"code\":\"UnsupportedFeature\"}}}"));
        assertEquals(
                FailureCategory.PROVIDER_ERROR,
                backend.classifyErrorBody("{\"error\":{\"code\":\"InvalidImage\"}}"));
        assertEquals(FailureCategory.PROVIDER_ERROR, backend.classifyErrorBody("<html>gateway</html>"));
        assertEquals(FailureCategory.PROVIDER_ERROR, backend.classifyErrorBody(""));
    }

    private static ProviderConfig provider(String endpoint) {
        return new ProviderConfig(
                "cloud-b", "Cloud B", ProviderType.CLOUD_B, true, true,
                new ProviderCredentials.SubscriptionKey(endpoint, SUBSCRIPTION_KEY), 0.6, 5);
    }

    private static String baseUrl(HttpServer httpServer) {
        return "http://" + httpServer.getAddress().getHostString() + ":" + httpServer.getAddress().getPort();
    }

    private static void respondJson(HttpExchange exchange, int statusCode, String responseJson) throws IOException {
        byte[] jsonBytes = responseJson.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, jsonBytes.length);
        try (OutputStream outputStream = exchange.getResponseBody()) {
            outputStream.write(jsonBytes);
        }
    }
}
