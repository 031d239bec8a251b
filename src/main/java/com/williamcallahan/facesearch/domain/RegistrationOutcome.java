package com.williamcallahan.facesearch.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of registering (or re-processing) one entity photo.
 *
 * @param entityId entity whose photo was processed
 * @param status status written to the embedding store
 * @param failure failure category when the record was stored as pending
 */
public record RegistrationOutcome(String entityId, DescriptorStatus status, Optional<FailureCategory> failure) {

    public RegistrationOutcome {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(status, "status");
        failure = failure == null ? Optional.empty() : failure;
    }

    /** Creates the outcome of a successful extraction. */
    public static RegistrationOutcome extracted(String entityId) {
        return new RegistrationOutcome(entityId, DescriptorStatus.EXTRACTED, Optional.empty());
    }

    /** Creates the outcome of an extraction stored as a pending placeholder. */
    public static RegistrationOutcome pending(String entityId, FailureCategory category) {
        return new RegistrationOutcome(entityId, DescriptorStatus.PENDING, Optional.of(category));
    }

    /** Returns true when a usable descriptor was stored. */
    public boolean isExtracted() {
        return status == DescriptorStatus.EXTRACTED;
    }
}
