package com.williamcallahan.facesearch.persistence;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DescriptorRecordRepository extends JpaRepository<DescriptorRecordEntity, String> {

    List<DescriptorRecordEntity> findByStatusIn(Collection<String> statuses);
}
