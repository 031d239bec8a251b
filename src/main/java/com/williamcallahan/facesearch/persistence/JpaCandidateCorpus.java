package com.williamcallahan.facesearch.persistence;

import com.williamcallahan.facesearch.domain.CandidateEntity;
import com.williamcallahan.facesearch.service.CandidateCorpus;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Candidate corpus read from {@code relationships} joined with the owning user.
 */
@Repository
public class JpaCandidateCorpus implements CandidateCorpus {

    private final RelationshipRepository relationshipRepository;

    public JpaCandidateCorpus(RelationshipRepository relationshipRepository) {
        this.relationshipRepository = Objects.requireNonNull(relationshipRepository, "relationshipRepository");
    }

    @Override
    @Transactional(readOnly = true)
    public List<CandidateEntity> findAllWithPhoto() {
        return relationshipRepository.findAllWithFacePhoto().stream()
                .filter(JpaCandidateCorpus::hasPhoto)
                .map(JpaCandidateCorpus::toCandidate)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CandidateEntity> findById(String entityId) {
        return relationshipRepository
                .findWithOwnerById(entityId)
                .filter(JpaCandidateCorpus::hasPhoto)
                .map(JpaCandidateCorpus::toCandidate);
    }

    private static boolean hasPhoto(RelationshipEntity relationship) {
        return relationship.getPartnerFacePhoto() != null && !relationship.getPartnerFacePhoto().isBlank();
    }

    private static CandidateEntity toCandidate(RelationshipEntity relationship) {
        UserEntity owner = relationship.getOwner();
        return new CandidateEntity(
                relationship.getId(),
                relationship.getPartnerFacePhoto(),
                relationship.getPartnerName(),
                relationship.getPartnerPhone(),
                relationship.getPartnerUserId(),
                relationship.getType(),
                relationship.getStatus(),
                owner.getId(),
                owner.getFullName(),
                owner.getPhoneNumber());
    }
}
