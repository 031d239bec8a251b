package com.williamcallahan.facesearch.domain;

/**
 * Classifies why a backend could not produce a descriptor or a similarity score.
 *
 * <p>Every category is retryable: a record that failed for any of these reasons stays pending and
 * is picked up again by the next regeneration run.</p>
 */
public enum FailureCategory {
    AUTHORIZATION_REQUIRED(
            "Face provider requires feature authorization for detection or comparison. "
                    + "Apply for access with the vendor, then re-run regeneration; affected photos stay pending."),
    NO_FACE_DETECTED("No face was detected in the photo."),
    IMAGE_UNAVAILABLE("The photo could not be loaded from its storage URL."),
    MISCONFIGURED("The active face provider is missing required credentials."),
    UNSUPPORTED_PROVIDER(
            "The active face provider has no recognition binding installed; photos stay pending until one is."),
    TIMEOUT("The face provider did not answer within the configured timeout."),
    PROVIDER_ERROR("The face provider rejected or failed the request."),
    PERSISTENCE_ERROR("The descriptor could not be written to the embedding store."),
    UNEXPECTED("Unexpected error while processing the photo.");

    private final String advisory;

    FailureCategory(String advisory) {
        this.advisory = advisory;
    }

    /**
     * Returns the operator-facing message shared by all failures of this category.
     */
    public String advisory() {
        return advisory;
    }
}
