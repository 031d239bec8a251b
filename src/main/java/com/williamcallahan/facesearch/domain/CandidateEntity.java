package com.williamcallahan.facesearch.domain;

import java.util.Objects;

/**
 * Entity with a registered partner photo, as exposed by the candidate corpus.
 *
 * @param entityId relationship id
 * @param photoReference stored photo reference (URL or storage path)
 * @param partnerName partner display name
 * @param partnerPhone partner phone number
 * @param partnerUserId partner account id when the partner is a registered user
 * @param relationshipType relationship type label
 * @param relationshipStatus relationship status label
 * @param ownerUserId id of the user who registered the relationship
 * @param ownerName owner display name
 * @param ownerPhone owner phone number
 */
public record CandidateEntity(
        String entityId,
        String photoReference,
        String partnerName,
        String partnerPhone,
        String partnerUserId,
        String relationshipType,
        String relationshipStatus,
        String ownerUserId,
        String ownerName,
        String ownerPhone) {

    public CandidateEntity {
        Objects.requireNonNull(entityId, "entityId is required");
        if (photoReference == null || photoReference.isBlank()) {
            throw new IllegalArgumentException("Candidate " + entityId + " has no registered photo");
        }
    }
}
