package com.williamcallahan.facesearch.domain;

/**
 * One search hit: the matched entity, its display fields and the similarity score.
 *
 * @param entityId relationship id
 * @param similarity similarity score in [0,1]
 * @param partnerName partner display name
 * @param partnerPhone partner phone number
 * @param partnerUserId partner account id, may be null
 * @param relationshipType relationship type label
 * @param relationshipStatus relationship status label
 * @param ownerUserId owner account id
 * @param ownerName owner display name
 * @param ownerPhone owner phone number
 * @param facePhotoUrl resolved URL of the matched photo
 */
public record MatchResult(
        String entityId,
        double similarity,
        String partnerName,
        String partnerPhone,
        String partnerUserId,
        String relationshipType,
        String relationshipStatus,
        String ownerUserId,
        String ownerName,
        String ownerPhone,
        String facePhotoUrl) {

    /**
     * Builds a result from a candidate and the score it reached.
     */
    public static MatchResult of(CandidateEntity candidate, String facePhotoUrl, double similarity) {
        return new MatchResult(
                candidate.entityId(),
                similarity,
                candidate.partnerName(),
                candidate.partnerPhone(),
                candidate.partnerUserId(),
                candidate.relationshipType(),
                candidate.relationshipStatus(),
                candidate.ownerUserId(),
                candidate.ownerName(),
                candidate.ownerPhone(),
                facePhotoUrl);
    }
}
