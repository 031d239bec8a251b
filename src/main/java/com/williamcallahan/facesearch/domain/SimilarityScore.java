package com.williamcallahan.facesearch.domain;

import java.util.Optional;

/**
 * Similarity between two descriptors.
 *
 * <p>A failed comparison scores {@code 0.0} so ranking can proceed, but keeps its
 * {@link FailureCategory} so callers can tell "could not compare" from "not similar".</p>
 *
 * @param score similarity in [0,1]
 * @param failure failure classification, empty for a real score
 */
public record SimilarityScore(double score, Optional<FailureCategory> failure) {

    public SimilarityScore {
        score = Double.isNaN(score) ? 0.0 : Math.max(0.0, Math.min(1.0, score));
        failure = failure == null ? Optional.empty() : failure;
    }

    /**
     * Creates a measured score, clamped into [0,1].
     */
    public static SimilarityScore of(double score) {
        return new SimilarityScore(score, Optional.empty());
    }

    /**
     * Creates a soft-failed score of {@code 0.0}.
     */
    public static SimilarityScore failed(FailureCategory category) {
        return new SimilarityScore(0.0, Optional.of(category));
    }

    /**
     * Returns true when the backend actually produced this score.
     */
    public boolean isMeasured() {
        return failure.isEmpty();
    }
}
