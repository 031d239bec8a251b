package com.williamcallahan.facesearch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.williamcallahan.facesearch.domain.ProviderStatus;
import com.williamcallahan.facesearch.service.ProviderAdminService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

/**
 * Verifies that the actuator reports face search as out of service without an active provider.
 */
class FaceProviderHealthIndicatorTest {
    private final ProviderAdminService providerAdminService = mock(ProviderAdminService.class);
    private final FaceProviderHealthIndicator healthIndicator = new FaceProviderHealthIndicator(providerAdminService);

    @Test
    void upWithActiveProvider() {
        when(providerAdminService.status()).thenReturn(new ProviderStatus(true, "cloud-b", "cloud_b", 0.6, 5));

        Health health = healthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("cloud-b", health.getDetails().get("providerId"));
        assertEquals("cloud_b", health.getDetails().get("providerType"));
    }

    @Test
    void outOfServiceWithoutProvider() {
        when(providerAdminService.status()).thenReturn(new ProviderStatus(false, null, null, null, null));

        assertEquals(Status.OUT_OF_SERVICE, healthIndicator.health().getStatus());
    }
}
