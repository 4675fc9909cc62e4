package com.flagship.payout_settlement.settings;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PlatformSetting {
    String key;
    String value;
    String category;
    String description;
    UUID updatedBy;
    Instant updatedAt;

    static PlatformSetting from(PlatformSettingEntity entity) {
        return new PlatformSetting(entity.getKey(), entity.getValue(), entity.getCategory(),
            entity.getDescription(), entity.getUpdatedBy(), entity.getUpdatedAt());
    }

    static PlatformSetting defaultFor(PlatformSettingKey key) {
        return new PlatformSetting(key.getKey(), key.getDefaultValue(), key.getCategory(),
            key.getDescription(), null, null);
    }
}
