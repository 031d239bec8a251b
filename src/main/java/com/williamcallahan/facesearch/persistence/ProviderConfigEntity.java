package com.williamcallahan.facesearch.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * Row of {@code face_matching_providers}. Credentials are kept as the raw JSON document.
 */
@Entity
@Table(name = "face_matching_providers")
public class ProviderConfigEntity {

    @Id
    @Column(name = "id", nullable = false, length = 64)
    private String id;

    @Column(name = "name")
    private String name;

    @Column(name = "provider_type", nullable = false, length = 32)
    private String providerType;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "is_enabled", nullable = false)
    private boolean enabled;

    @Column(name = "credentials", length = 8192)
    private String credentials;

    @Column(name = "similarity_threshold", nullable = false)
    private double similarityThreshold;

    @Column(name = "max_results", nullable = false)
    private int maxResults;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected ProviderConfigEntity() {}

    public ProviderConfigEntity(
            String id,
            String name,
            String providerType,
            boolean active,
            boolean enabled,
            String credentials,
            double similarityThreshold,
            int maxResults) {
        this.id = id;
        this.name = name;
        this.providerType = providerType;
        this.active = active;
        this.enabled = enabled;
        this.credentials = credentials;
        this.similarityThreshold = similarityThreshold;
        this.maxResults = maxResults;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getProviderType() { return providerType; }
    public boolean isActive() { return active; }
    public boolean isEnabled() { return enabled; }
    public String getCredentials() { return credentials; }
    public double getSimilarityThreshold() { return similarityThreshold; }
    public int getMaxResults() { return maxResults; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void setActive(boolean active) { this.active = active; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
