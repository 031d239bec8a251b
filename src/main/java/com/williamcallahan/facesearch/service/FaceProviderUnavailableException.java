package com.williamcallahan.facesearch.service;

/**
 * Signals that no recognition provider is both active and enabled.
 *
 * <p>Callers surface this as "feature unavailable" rather than as a server fault.</p>
 */
public class FaceProviderUnavailableException extends RuntimeException {

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message explanation of the missing provider
     */
    public FaceProviderUnavailableException(String message) {
        super(message);
    }
}
