package com.williamcallahan.facesearch.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.facesearch.domain.ProviderCredentials;
import com.williamcallahan.facesearch.domain.ProviderType;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Decodes the credentials JSON stored with a provider row into the typed variant for its provider type.
 */
@Component
public class ProviderCredentialsCodec {
    private static final TypeReference<Map<String, Object>> EXTRA_CONFIG_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ProviderCredentialsCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Decodes stored credentials. Missing fields decode to null and surface later as an incomplete credential.
     *
     * @param providerType provider type of the row
     * @param credentialsJson stored JSON document, may be null or blank
     * @return typed credentials
     * @throws IllegalArgumentException when the document is not valid JSON
     */
    public ProviderCredentials decode(ProviderType providerType, String credentialsJson) {
        JsonNode credentialsNode = parse(credentialsJson);
        return switch (providerType) {
            case CLOUD_A -> new ProviderCredentials.AccessKey(
                    text(credentialsNode, "accessKeyId"),
                    text(credentialsNode, "secretAccessKey"),
                    text(credentialsNode, "region"));
            case CLOUD_B -> new ProviderCredentials.SubscriptionKey(
                    text(credentialsNode, "endpoint"), text(credentialsNode, "subscriptionKey"));
            case CLOUD_C -> new ProviderCredentials.ServiceAccount(
                    text(credentialsNode, "projectId"), text(credentialsNode, "credentialsJson"));
            case CUSTOM_HTTP -> new ProviderCredentials.HttpEndpoint(
                    text(credentialsNode, "endpoint"),
                    text(credentialsNode, "apiKey"),
                    extraConfig(credentialsNode.get("extraConfig")));
            case LOCAL_FALLBACK -> new ProviderCredentials.None();
        };
    }

    private JsonNode parse(String credentialsJson) {
        if (credentialsJson == null || credentialsJson.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(credentialsJson);
        } catch (JsonProcessingException parseException) {
            throw new IllegalArgumentException(
                    "Provider credentials are not valid JSON: " + parseException.getOriginalMessage(), parseException);
        }
    }

    private Map<String, Object> extraConfig(JsonNode extraConfigNode) {
        if (extraConfigNode == null || !extraConfigNode.isObject()) {
            return Map.of();
        }
        Map<String, Object> extraConfig = new LinkedHashMap<>(objectMapper.convertValue(extraConfigNode, EXTRA_CONFIG_TYPE));
        extraConfig.values().removeIf(Objects::isNull);
        return extraConfig;
    }

    private static String text(JsonNode node, String fieldName) {
        JsonNode field = node.get(fieldName);
        return field == null || field.isNull() ? null : field.asText();
    }
}
