package com.williamcallahan.facesearch.web;

import com.williamcallahan.facesearch.domain.DescriptorRecord;
import java.time.Instant;
import java.util.List;

/**
 * Descriptor records still waiting for a successful extraction.
 *
 * @param status fixed "success"
 * @param records pending records with their display fields
 */
public record PendingDescriptorsResponse(String status, List<PendingDescriptor> records) implements ApiResponse {

    public static PendingDescriptorsResponse from(List<DescriptorRecord> descriptorRecords) {
        return new PendingDescriptorsResponse(
                "success",
                descriptorRecords.stream()
                        .map(descriptorRecord -> new PendingDescriptor(
                                descriptorRecord.entityId(),
                                descriptorRecord.providerType().value(),
                                descriptorRecord.status().value(),
                                descriptorRecord.sourcePhotoUrl(),
                                descriptorRecord.updatedAt(),
                                descriptorRecord.partnerName(),
                                descriptorRecord.partnerPhone()))
                        .toList());
    }

    /**
     * One pending record.
     */
    public record PendingDescriptor(
            String entityId,
            String providerType,
            String descriptorStatus,
            String sourcePhotoUrl,
            Instant updatedAt,
            String partnerName,
            String partnerPhone) {}
}
