package com.williamcallahan.facesearch.service;

import com.williamcallahan.facesearch.domain.DescriptorRecord;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed store of face descriptor records, one per entity.
 *
 * <p>Every operation reports storage failures as {@link DescriptorPersistenceException}.</p>
 */
public interface EmbeddingStore {

    /**
     * Inserts or replaces the record for its entity; the latest write wins.
     */
    void upsert(DescriptorRecord descriptorRecord);

    Optional<DescriptorRecord> get(String entityId);

    /**
     * Returns the stored records of the given entities keyed by entity id; entities without a record are absent.
     */
    Map<String, DescriptorRecord> findAll(Collection<String> entityIds);

    /**
     * Returns records whose status is {@code pending} or {@code none}.
     */
    List<DescriptorRecord> listNeedingDescriptor();

    /**
     * Removes the record of an entity; a missing record is not an error.
     *
     * @return true when a record was removed
     */
    boolean delete(String entityId);
}
