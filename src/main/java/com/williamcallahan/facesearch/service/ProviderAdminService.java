package com.williamcallahan.facesearch.service;

import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.ProviderStatus;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Provider selection for operators.
 */
@Service
public class ProviderAdminService {

    private final ProviderConfigStore providerConfigStore;
    private final ProviderRegistry providerRegistry;

    public ProviderAdminService(ProviderConfigStore providerConfigStore, ProviderRegistry providerRegistry) {
        this.providerConfigStore = Objects.requireNonNull(providerConfigStore, "providerConfigStore");
        this.providerRegistry = Objects.requireNonNull(providerRegistry, "providerRegistry");
    }

    /**
     * Reports whether face search currently has a provider, so an empty result can be told apart from no match.
     */
    public ProviderStatus status() {
        return ProviderStatus.from(providerRegistry.getActive());
    }

    /**
     * Makes the provider the single active one and drops the cached snapshot.
     *
     * @throws IllegalArgumentException when the provider is unknown or disabled
     */
    public ProviderStatus activate(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            throw new IllegalArgumentException("Provider id is required");
        }
        ProviderConfig activated = providerConfigStore.activate(providerId);
        providerRegistry.invalidate();
        return ProviderStatus.from(Optional.of(activated));
    }
}
