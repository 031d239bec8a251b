package com.williamcallahan.facesearch.service.recognition;

import com.williamcallahan.facesearch.domain.ProviderCredentials;
import com.williamcallahan.facesearch.domain.ProviderType;
import org.springframework.stereotype.Component;

/**
 * Service-account cloud backend; credentials are validated but no vendor client is bound.
 */
@Component
public class CloudCRecognitionBackend extends UnboundRecognitionBackend {

    public CloudCRecognitionBackend() {
        super(ProviderType.CLOUD_C, ProviderCredentials.ServiceAccount.class);
    }
}
