package com.williamcallahan.facesearch.service;

import com.williamcallahan.facesearch.domain.CandidateEntity;
import java.util.List;
import java.util.Optional;

/**
 * Entities with a registered partner photo.
 */
public interface CandidateCorpus {

    /**
     * Returns every entity with a non-empty photo field, in a stable order.
     */
    List<CandidateEntity> findAllWithPhoto();

    /**
     * Returns the entity when it exists and has a registered photo.
     */
    Optional<CandidateEntity> findById(String entityId);
}
