package com.williamcallahan.facesearch.domain;

import java.util.Map;

/**
 * Backend-specific credentials attached to a provider configuration.
 *
 * <p>Each variant matches exactly one {@link ProviderType}. Values are never logged.</p>
 */
public sealed interface ProviderCredentials
        permits ProviderCredentials.AccessKey,
                ProviderCredentials.SubscriptionKey,
                ProviderCredentials.ServiceAccount,
                ProviderCredentials.HttpEndpoint,
                ProviderCredentials.None {

    /**
     * Returns true when every field the backend needs is present.
     */
    boolean isComplete();

    /**
     * Access key pair for {@link ProviderType#CLOUD_A}.
     *
     * @param accessKeyId access key identifier
     * @param secretAccessKey secret paired with the key id
     * @param region service region, defaults to {@code us-east-1}
     */
    record AccessKey(String accessKeyId, String secretAccessKey, String region) implements ProviderCredentials {
        private static final String DEFAULT_REGION = "us-east-1";

        public AccessKey {
            region = region == null || region.isBlank() ? DEFAULT_REGION : region;
        }

        @Override
        public boolean isComplete() {
            return hasText(accessKeyId) && hasText(secretAccessKey);
        }

        @Override
        public String toString() {
            return "AccessKey[region=" + region + "]";
        }
    }

    /**
     * Endpoint and subscription key for {@link ProviderType#CLOUD_B}.
     *
     * @param endpoint service base URL
     * @param subscriptionKey subscription key sent on every request
     */
    record SubscriptionKey(String endpoint, String subscriptionKey) implements ProviderCredentials {
        @Override
        public boolean isComplete() {
            return hasText(endpoint) && hasText(subscriptionKey);
        }

        @Override
        public String toString() {
            return "SubscriptionKey[endpoint=" + endpoint + "]";
        }
    }

    /**
     * Project id and service-account JSON for {@link ProviderType#CLOUD_C}.
     *
     * @param projectId cloud project identifier
     * @param credentialsJson service-account credential document
     */
    record ServiceAccount(String projectId, String credentialsJson) implements ProviderCredentials {
        @Override
        public boolean isComplete() {
            return hasText(projectId) && hasText(credentialsJson);
        }

        @Override
        public String toString() {
            return "ServiceAccount[projectId=" + projectId + "]";
        }
    }

    /**
     * Endpoint, bearer key and optional extra request fields for {@link ProviderType#CUSTOM_HTTP}.
     *
     * @param endpoint recognition endpoint URL
     * @param apiKey bearer token
     * @param extraConfig fields merged into every request body
     */
    record HttpEndpoint(String endpoint, String apiKey, Map<String, Object> extraConfig)
            implements ProviderCredentials {
        public HttpEndpoint {
            extraConfig = extraConfig == null ? Map.of() : Map.copyOf(extraConfig);
        }

        @Override
        public boolean isComplete() {
            return hasText(endpoint) && hasText(apiKey);
        }

        @Override
        public String toString() {
            return "HttpEndpoint[endpoint=" + endpoint + ", extraConfigKeys=" + extraConfig.keySet() + "]";
        }
    }

    /**
     * Marker for {@link ProviderType#LOCAL_FALLBACK}, which needs no credentials.
     */
    record None() implements ProviderCredentials {
        @Override
        public boolean isComplete() {
            return true;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
