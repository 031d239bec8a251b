package com.williamcallahan.facesearch.persistence;

import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProviderConfigRepository extends JpaRepository<ProviderConfigEntity, String> {

    List<ProviderConfigEntity> findByActiveTrueAndEnabledTrue();

    @Modifying
    @Query("update ProviderConfigEntity p set p.active = false, p.updatedAt = :now "
            + "where p.active = true and p.id <> :providerId")
    int deactivateAllExcept(@Param("providerId") String providerId, @Param("now") Instant now);
}
