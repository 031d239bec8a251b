package com.williamcallahan.facesearch.persistence;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RelationshipRepository extends JpaRepository<RelationshipEntity, String> {

    @Query("select r from RelationshipEntity r join fetch r.owner "
            + "where r.partnerFacePhoto is not null and r.partnerFacePhoto <> '' order by r.id")
    List<RelationshipEntity> findAllWithFacePhoto();

    @Query("select r from RelationshipEntity r join fetch r.owner where r.id = :id")
    Optional<RelationshipEntity> findWithOwnerById(@Param("id") String id);
}
