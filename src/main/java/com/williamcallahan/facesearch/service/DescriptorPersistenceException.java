package com.williamcallahan.facesearch.service;

/**
 * Signals that the embedding store could not read or write descriptor records.
 *
 * <p>Propagates out of search and registration; the regeneration job records it per candidate.</p>
 */
public class DescriptorPersistenceException extends RuntimeException {

    /**
     * Creates an exception with a message and the original cause.
     *
     * @param message explanation of the persistence failure
     * @param cause underlying data access exception
     */
    public DescriptorPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
