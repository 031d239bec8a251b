package com.williamcallahan.facesearch.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * Row of {@code face_embeddings}, one per relationship.
 */
@Entity
@Table(name = "face_embeddings")
public class DescriptorRecordEntity {

    @Id
    @Column(name = "relationship_id", nullable = false, length = 64)
    private String entityId;

    @Column(name = "face_id", length = 512)
    private String descriptorId;

    @Column(name = "provider_type", nullable = false, length = 32)
    private String providerType;

    @Column(name = "face_photo_url", length = 2048)
    private String sourcePhotoUrl;

    @Column(name = "status", nullable = false, length = 16)
    private String status;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "partner_name")
    private String partnerName;

    @Column(name = "partner_phone")
    private String partnerPhone;

    protected DescriptorRecordEntity() {}

    public DescriptorRecordEntity(
            String entityId,
            String descriptorId,
            String providerType,
            String sourcePhotoUrl,
            String status,
            Instant updatedAt,
            String partnerName,
            String partnerPhone) {
        this.entityId = entityId;
        this.descriptorId = descriptorId;
        this.providerType = providerType;
        this.sourcePhotoUrl = sourcePhotoUrl;
        this.status = status;
        this.updatedAt = updatedAt;
        this.partnerName = partnerName;
        this.partnerPhone = partnerPhone;
    }

    public String getEntityId() { return entityId; }
    public String getDescriptorId() { return descriptorId; }
    public String getProviderType() { return providerType; }
    public String getSourcePhotoUrl() { return sourcePhotoUrl; }
    public String getStatus() { return status; }
    public Instant getUpdatedAt() { return updatedAt; }
    public String getPartnerName() { return partnerName; }
    public String getPartnerPhone() { return partnerPhone; }
}
