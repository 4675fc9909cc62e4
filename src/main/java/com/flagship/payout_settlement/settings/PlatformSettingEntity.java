package com.flagship.payout_settlement.settings;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "platform_settings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PlatformSettingEntity {

    @Id
    @Column(name = "key", nullable = false, updatable = false, length = 100)
    private String key;

    @Column(name = "value", nullable = false, columnDefinition = "TEXT")
    private String value;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "category", nullable = false, length = 50)
    private String category;

    @Column(name = "updated_by")
    private UUID updatedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static PlatformSettingEntity create(PlatformSettingKey key, String value, UUID updatedBy) {
        PlatformSettingEntity entity = new PlatformSettingEntity();
        entity.key = key.getKey();
        entity.value = value;
        entity.description = key.getDescription();
        entity.category = key.getCategory();
        entity.updatedBy = updatedBy;
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    void update(String value, UUID updatedBy) {
        this.value = value;
        this.updatedBy = updatedBy;
    }
}
