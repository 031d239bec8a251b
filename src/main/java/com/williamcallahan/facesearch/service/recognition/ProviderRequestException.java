package com.williamcallahan.facesearch.service.recognition;

import com.williamcallahan.facesearch.domain.FailureCategory;
import java.util.Objects;

/**
 * Signals a failed backend call inside a recognition backend.
 *
 * <p>Never leaves the backend: it is converted into an {@code Unavailable} extraction outcome or a
 * failed similarity score at the backend boundary.</p>
 */
public class ProviderRequestException extends RuntimeException {
    private final FailureCategory category;

    /**
     * Creates a request failure with a classification.
     */
    public ProviderRequestException(FailureCategory category, String message) {
        super(message);
        this.category = Objects.requireNonNull(category, "category");
    }

    /**
     * Creates a request failure with a classification and the underlying cause.
     */
    public ProviderRequestException(FailureCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = Objects.requireNonNull(category, "category");
    }

    public FailureCategory category() {
        return category;
    }
}
