package com.williamcallahan.facesearch.persistence;

import com.williamcallahan.facesearch.domain.DescriptorRecord;
import com.williamcallahan.facesearch.domain.DescriptorStatus;
import com.williamcallahan.facesearch.domain.ProviderType;
import com.williamcallahan.facesearch.service.DescriptorPersistenceException;
import com.williamcallahan.facesearch.service.EmbeddingStore;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link EmbeddingStore} over the {@code face_embeddings} table.
 */
@Repository
public class JpaEmbeddingStore implements EmbeddingStore {
    private static final List<String> NEEDING_DESCRIPTOR_STATUSES =
            List.of(DescriptorStatus.PENDING.value(), DescriptorStatus.NONE.value());

    private final DescriptorRecordRepository descriptorRecordRepository;

    public JpaEmbeddingStore(DescriptorRecordRepository descriptorRecordRepository) {
        this.descriptorRecordRepository = Objects.requireNonNull(descriptorRecordRepository, "descriptorRecordRepository");
    }

    @Override
    @Transactional
    public void upsert(DescriptorRecord descriptorRecord) {
        Objects.requireNonNull(descriptorRecord, "descriptorRecord");
        try {
            descriptorRecordRepository.saveAndFlush(toEntity(descriptorRecord));
        } catch (DataAccessException storageFailure) {
            throw new DescriptorPersistenceException(
                    "Failed to store descriptor for entity " + descriptorRecord.entityId(), storageFailure);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DescriptorRecord> get(String entityId) {
        try {
            return descriptorRecordRepository.findById(entityId).map(JpaEmbeddingStore::toRecord);
        } catch (DataAccessException storageFailure) {
            throw new DescriptorPersistenceException("Failed to read descriptor for entity " + entityId, storageFailure);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, DescriptorRecord> findAll(Collection<String> entityIds) {
        if (entityIds == null || entityIds.isEmpty()) {
            return Map.of();
        }
        try {
            Map<String, DescriptorRecord> recordsByEntity = new LinkedHashMap<>();
            for (DescriptorRecordEntity entity : descriptorRecordRepository.findAllById(entityIds)) {
                recordsByEntity.put(entity.getEntityId(), toRecord(entity));
            }
            return recordsByEntity;
        } catch (DataAccessException storageFailure) {
            throw new DescriptorPersistenceException(
                    "Failed to read descriptors for " + entityIds.size() + " entities", storageFailure);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<DescriptorRecord> listNeedingDescriptor() {
        try {
            return descriptorRecordRepository.findByStatusIn(NEEDING_DESCRIPTOR_STATUSES).stream()
                    .map(JpaEmbeddingStore::toRecord)
                    .toList();
        } catch (DataAccessException storageFailure) {
            throw new DescriptorPersistenceException("Failed to list descriptors needing extraction", storageFailure);
        }
    }

    @Override
    @Transactional
    public boolean delete(String entityId) {
        try {
            if (!descriptorRecordRepository.existsById(entityId)) {
                return false;
            }
            descriptorRecordRepository.deleteById(entityId);
            return true;
        } catch (DataAccessException storageFailure) {
            throw new DescriptorPersistenceException("Failed to delete descriptor for entity " + entityId, storageFailure);
        }
    }

    private static DescriptorRecordEntity toEntity(DescriptorRecord descriptorRecord) {
        return new DescriptorRecordEntity(
                descriptorRecord.entityId(),
                descriptorRecord.descriptorId(),
                descriptorRecord.providerType().value(),
                descriptorRecord.sourcePhotoUrl(),
                descriptorRecord.status().value(),
                descriptorRecord.updatedAt(),
                descriptorRecord.partnerName(),
                descriptorRecord.partnerPhone());
    }

    private static DescriptorRecord toRecord(DescriptorRecordEntity entity) {
        try {
            return new DescriptorRecord(
                    entity.getEntityId(),
                    entity.getDescriptorId(),
                    ProviderType.fromValue(entity.getProviderType()),
                    entity.getSourcePhotoUrl(),
                    DescriptorStatus.fromValue(entity.getStatus()),
                    entity.getUpdatedAt(),
                    entity.getPartnerName(),
                    entity.getPartnerPhone());
        } catch (IllegalArgumentException | NullPointerException corruptRow) {
            throw new DescriptorPersistenceException(
                    "Stored descriptor for entity " + entity.getEntityId() + " is invalid", corruptRow);
        }
    }
}
