package com.williamcallahan.facesearch.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Stored face descriptor for one entity, keyed by entity id.
 *
 * @param entityId owning entity (relationship) id
 * @param descriptorId opaque descriptor, null unless {@code status} is {@link DescriptorStatus#EXTRACTED}
 * @param providerType provider type that produced (or failed to produce) the descriptor
 * @param sourcePhotoUrl photo the descriptor was extracted from
 * @param status lifecycle state
 * @param updatedAt time of the last write
 * @param partnerName denormalized display name
 * @param partnerPhone denormalized display phone
 */
public record DescriptorRecord(
        String entityId,
        String descriptorId,
        ProviderType providerType,
        String sourcePhotoUrl,
        DescriptorStatus status,
        Instant updatedAt,
        String partnerName,
        String partnerPhone) {

    public DescriptorRecord {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(providerType, "providerType is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(updatedAt, "updatedAt is required");
        if (status == DescriptorStatus.EXTRACTED && (descriptorId == null || descriptorId.isBlank())) {
            throw new IllegalArgumentException("Extracted descriptor record requires a descriptor id");
        }
        if (status != DescriptorStatus.EXTRACTED) {
            descriptorId = null;
        }
    }

    /**
     * Creates a record for a successfully extracted descriptor.
     */
    public static DescriptorRecord extracted(
            CandidateEntity candidate, String descriptorId, ProviderType providerType, String photoUrl, Instant now) {
        return new DescriptorRecord(
                candidate.entityId(),
                descriptorId,
                providerType,
                photoUrl,
                DescriptorStatus.EXTRACTED,
                now,
                candidate.partnerName(),
                candidate.partnerPhone());
    }

    /**
     * Creates a placeholder for a photo whose extraction has to be retried later.
     */
    public static DescriptorRecord pending(
            CandidateEntity candidate, ProviderType providerType, String photoUrl, Instant now) {
        return new DescriptorRecord(
                candidate.entityId(),
                null,
                providerType,
                photoUrl,
                DescriptorStatus.PENDING,
                now,
                candidate.partnerName(),
                candidate.partnerPhone());
    }

    /**
     * Returns true when this record holds a descriptor extracted by the given provider type from
     * the given photo. A record for a replaced photo describes the old face.
     *
     * @param currentType provider type of the active backend
     * @param currentPhotoUrl resolved URL of the entity's current photo
     */
    public boolean isCurrentFor(ProviderType currentType, String currentPhotoUrl) {
        return status == DescriptorStatus.EXTRACTED
                && providerType == currentType
                && Objects.equals(sourcePhotoUrl, currentPhotoUrl);
    }

    /**
     * Returns the descriptor when it can be compared under the given provider type at {@code now}.
     *
     * @param currentType provider type of the active backend
     * @param currentPhotoUrl resolved URL of the entity's current photo
     * @param validity how long descriptors of that backend stay valid, empty when they never expire
     * @param now evaluation time
     * @return reusable descriptor id, or empty when it must be re-extracted
     */
    public Optional<String> reusableDescriptor(
            ProviderType currentType, String currentPhotoUrl, Optional<Duration> validity, Instant now) {
        if (!isCurrentFor(currentType, currentPhotoUrl)) {
            return Optional.empty();
        }
        if (validity.isPresent() && !updatedAt.plus(validity.get()).isAfter(now)) {
            return Optional.empty();
        }
        return Optional.of(descriptorId);
    }
}
