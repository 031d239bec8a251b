package com.williamcallahan.facesearch.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a descriptor extraction: either a descriptor id or a retryable failure.
 *
 * <p>Extraction never throws for backend failures; callers branch on this type instead.</p>
 */
public sealed interface ExtractionOutcome permits ExtractionOutcome.Extracted, ExtractionOutcome.Unavailable {

    /**
     * Returns the descriptor id when extraction succeeded.
     */
    Optional<String> descriptorId();

    /**
     * Creates a successful outcome.
     *
     * @param descriptorId opaque descriptor id
     * @return extracted outcome
     */
    static ExtractionOutcome extracted(String descriptorId) {
        return new Extracted(descriptorId);
    }

    /**
     * Creates a failed outcome.
     *
     * @param category failure classification
     * @param detail sanitized diagnostic detail
     * @return unavailable outcome
     */
    static ExtractionOutcome unavailable(FailureCategory category, String detail) {
        return new Unavailable(category, detail);
    }

    /**
     * Descriptor produced by the backend.
     *
     * @param id opaque descriptor id
     */
    record Extracted(String id) implements ExtractionOutcome {
        public Extracted {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Descriptor id must not be blank");
            }
        }

        @Override
        public Optional<String> descriptorId() {
            return Optional.of(id);
        }
    }

    /**
     * Backend could not produce a descriptor right now.
     *
     * @param category failure classification
     * @param detail sanitized diagnostic detail
     */
    record Unavailable(FailureCategory category, String detail) implements ExtractionOutcome {
        public Unavailable {
            Objects.requireNonNull(category, "category");
            detail = detail == null ? "" : detail;
        }

        @Override
        public Optional<String> descriptorId() {
            return Optional.empty();
        }
    }
}
