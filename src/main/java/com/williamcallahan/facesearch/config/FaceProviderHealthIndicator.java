package com.williamcallahan.facesearch.config;

import com.williamcallahan.facesearch.domain.ProviderStatus;
import com.williamcallahan.facesearch.service.ProviderAdminService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Spring Actuator health indicator reporting whether face search has an active provider.
 *
 * <p>Registered as {@code faceProvider}. Without a provider the service still runs but every
 * search returns no matches, so the state is OUT_OF_SERVICE rather than DOWN.</p>
 */
@Component("faceProvider")
public class FaceProviderHealthIndicator implements HealthIndicator {

    private static final String DETAIL_KEY_PROVIDER_ID = "providerId";
    private static final String DETAIL_KEY_PROVIDER_TYPE = "providerType";
    private static final String DETAIL_KEY_STATUS = "status";

    private final ProviderAdminService providerAdminService;

    public FaceProviderHealthIndicator(ProviderAdminService providerAdminService) {
        this.providerAdminService = providerAdminService;
    }

    @Override
    public Health health() {
        ProviderStatus providerStatus = providerAdminService.status();
        if (providerStatus.available()) {
            return Health.up()
                    .withDetail(DETAIL_KEY_PROVIDER_ID, providerStatus.providerId())
                    .withDetail(DETAIL_KEY_PROVIDER_TYPE, providerStatus.providerType())
                    .build();
        }
        return Health.outOfService()
                .withDetail(DETAIL_KEY_STATUS, "No active and enabled face provider")
                .build();
    }
}
