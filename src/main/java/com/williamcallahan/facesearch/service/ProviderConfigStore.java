package com.williamcallahan.facesearch.service;

import com.williamcallahan.facesearch.domain.ProviderConfig;
import java.util.List;

/**
 * Persistent source of provider configurations.
 */
public interface ProviderConfigStore {

    /**
     * Returns every provider that is both active and enabled. More than one entry is a configuration error.
     */
    List<ProviderConfig> findActiveAndEnabled();

    /**
     * Makes the provider the only active one.
     *
     * @param providerId provider to activate
     * @return the activated provider
     * @throws IllegalArgumentException when the provider does not exist or is disabled
     */
    ProviderConfig activate(String providerId);
}
