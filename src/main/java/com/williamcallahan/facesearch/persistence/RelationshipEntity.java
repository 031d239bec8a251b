package com.williamcallahan.facesearch.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Relationship record owning a registered partner photo.
 */
@Entity
@Table(name = "relationships")
public class RelationshipEntity {

    @Id
    @Column(name = "id", nullable = false, length = 64)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private UserEntity owner;

    @Column(name = "partner_name", nullable = false)
    private String partnerName;

    @Column(name = "partner_phone", nullable = false)
    private String partnerPhone;

    @Column(name = "partner_user_id", length = 64)
    private String partnerUserId;

    @Column(name = "type", nullable = false, length = 32)
    private String type;

    @Column(name = "status", nullable = false, length = 32)
    private String status;

    @Column(name = "partner_face_photo", length = 2048)
    private String partnerFacePhoto;

    protected RelationshipEntity() {}

    public RelationshipEntity(
            String id,
            UserEntity owner,
            String partnerName,
            String partnerPhone,
            String partnerUserId,
            String type,
            String status,
            String partnerFacePhoto) {
        this.id = id;
        this.owner = owner;
        this.partnerName = partnerName;
        this.partnerPhone = partnerPhone;
        this.partnerUserId = partnerUserId;
        this.type = type;
        this.status = status;
        this.partnerFacePhoto = partnerFacePhoto;
    }

    public String getId() { return id; }
    public UserEntity getOwner() { return owner; }
    public String getPartnerName() { return partnerName; }
    public String getPartnerPhone() { return partnerPhone; }
    public String getPartnerUserId() { return partnerUserId; }
    public String getType() { return type; }
    public String getStatus() { return status; }
    public String getPartnerFacePhoto() { return partnerFacePhoto; }
}
