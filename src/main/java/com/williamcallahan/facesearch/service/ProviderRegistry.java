package com.williamcallahan.facesearch.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.Ticker;
import com.williamcallahan.facesearch.config.AppProperties;
import com.williamcallahan.facesearch.domain.ProviderConfig;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves the single active and enabled provider, caching the answer for a fixed TTL.
 *
 * <p>Within the TTL the store is not read again; after expiry the next caller reloads it once.
 * "No provider" is cached like any other answer. A store failure is not cached, so the next call
 * retries the store.</p>
 */
@Service
public class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);
    private static final String ACTIVE_PROVIDER_KEY = "active";

    private final ProviderConfigStore providerConfigStore;
    private final LoadingCache<String, Optional<ProviderConfig>> activeProviderCache;

    /**
     * Creates the registry.
     *
     * @param providerConfigStore persistent provider configurations
     * @param appProperties application configuration providing the cache TTL
     * @param providerCacheTicker time source of the cache
     */
    public ProviderRegistry(
            ProviderConfigStore providerConfigStore, AppProperties appProperties, Ticker providerCacheTicker) {
        this.providerConfigStore = Objects.requireNonNull(providerConfigStore, "providerConfigStore");
        this.activeProviderCache = Caffeine.newBuilder()
                .expireAfterWrite(appProperties.getProvider().getCacheTtl())
                .ticker(Objects.requireNonNull(providerCacheTicker, "providerCacheTicker"))
                .maximumSize(1)
                .build(key -> loadActiveProvider());
    }

    /**
     * Returns the active provider, or empty when none is active and enabled.
     */
    public Optional<ProviderConfig> getActive() {
        try {
            return activeProviderCache.get(ACTIVE_PROVIDER_KEY);
        } catch (RuntimeException storeFailure) {
            log.error("[FACE-PROVIDER] Could not load active provider; reporting none until the store recovers",
                    storeFailure);
            return Optional.empty();
        }
    }

    /**
     * Drops the cached snapshot so the next call reads the store.
     */
    public void invalidate() {
        activeProviderCache.invalidateAll();
        log.debug("[FACE-PROVIDER] Active provider cache invalidated");
    }

    private Optional<ProviderConfig> loadActiveProvider() {
        List<ProviderConfig> activeProviders = providerConfigStore.findActiveAndEnabled();
        if (activeProviders.isEmpty()) {
            log.info("[FACE-PROVIDER] No active face provider configured");
            return Optional.empty();
        }
        if (activeProviders.size() > 1) {
            log.error("[FACE-PROVIDER] {} providers are active and enabled ({}); face search disabled until one remains",
                    activeProviders.size(),
                    activeProviders.stream().map(ProviderConfig::id).toList());
            return Optional.empty();
        }
        ProviderConfig activeProvider = activeProviders.get(0);
        log.info("[FACE-PROVIDER] Active provider {} ({})", activeProvider.id(), activeProvider.providerType().value());
        return Optional.of(activeProvider);
    }
}
