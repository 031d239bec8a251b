package com.williamcallahan.facesearch.persistence;

import com.williamcallahan.facesearch.domain.ProviderConfig;
import com.williamcallahan.facesearch.domain.ProviderType;
import com.williamcallahan.facesearch.service.ProviderConfigStore;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Provider configurations backed by {@code face_matching_providers}.
 */
@Repository
public class JpaProviderConfigStore implements ProviderConfigStore {
    private static final Logger log = LoggerFactory.getLogger(JpaProviderConfigStore.class);

    private final ProviderConfigRepository providerConfigRepository;
    private final ProviderCredentialsCodec credentialsCodec;
    private final Clock clock;

    public JpaProviderConfigStore(
            ProviderConfigRepository providerConfigRepository, ProviderCredentialsCodec credentialsCodec, Clock clock) {
        this.providerConfigRepository = Objects.requireNonNull(providerConfigRepository, "providerConfigRepository");
        this.credentialsCodec = Objects.requireNonNull(credentialsCodec, "credentialsCodec");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProviderConfig> findActiveAndEnabled() {
        return providerConfigRepository.findByActiveTrueAndEnabledTrue().stream()
                .map(this::toProviderConfig)
                .toList();
    }

    @Override
    @Transactional
    public ProviderConfig activate(String providerId) {
        ProviderConfigEntity provider = providerConfigRepository
                .findById(providerId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown face provider: " + providerId));
        if (!provider.isEnabled()) {
            throw new IllegalArgumentException("Face provider " + providerId + " is disabled");
        }
        int deactivated = providerConfigRepository.deactivateAllExcept(providerId, clock.instant());
        provider.setActive(true);
        provider.setUpdatedAt(clock.instant());
        log.info("[FACE-PROVIDER] Activated provider {} and deactivated {} other(s)", providerId, deactivated);
        return toProviderConfig(provider);
    }

    private ProviderConfig toProviderConfig(ProviderConfigEntity entity) {
        ProviderType providerType = ProviderType.fromValue(entity.getProviderType());
        return new ProviderConfig(
                entity.getId(),
                entity.getName(),
                providerType,
                entity.isActive(),
                entity.isEnabled(),
                credentialsCodec.decode(providerType, entity.getCredentials()),
                entity.getSimilarityThreshold(),
                entity.getMaxResults());
    }
}
