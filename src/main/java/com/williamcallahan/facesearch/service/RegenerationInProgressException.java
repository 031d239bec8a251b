package com.williamcallahan.facesearch.service;

/**
 * Signals that a regeneration run was requested while another one is still processing.
 */
public class RegenerationInProgressException extends RuntimeException {

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message explanation of the rejected run
     */
    public RegenerationInProgressException(String message) {
        super(message);
    }
}
