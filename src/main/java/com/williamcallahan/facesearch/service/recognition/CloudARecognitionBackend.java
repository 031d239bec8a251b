package com.williamcallahan.facesearch.service.recognition;

import com.williamcallahan.facesearch.domain.ProviderCredentials;
import com.williamcallahan.facesearch.domain.ProviderType;
import org.springframework.stereotype.Component;

/**
 * Access-key cloud backend; credentials are validated but no vendor client is bound.
 */
@Component
public class CloudARecognitionBackend extends UnboundRecognitionBackend {

    public CloudARecognitionBackend() {
        super(ProviderType.CLOUD_A, ProviderCredentials.AccessKey.class);
    }
}
