package com.flagship.payout_settlement.settings.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_settlement.settings.PlatformSetting;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PlatformSettingResponse {

    @JsonProperty("key")
    String key;

    @JsonProperty("value")
    String value;

    @JsonProperty("category")
    String category;

    @JsonProperty("description")
    String description;

    @JsonProperty("updated_by")
    UUID updatedBy;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PlatformSettingResponse from(PlatformSetting setting) {
        return PlatformSettingResponse.builder()
            .key(setting.getKey())
            .value(setting.getValue())
            .category(setting.getCategory())
            .description(setting.getDescription())
            .updatedBy(setting.getUpdatedBy())
            .updatedAt(setting.getUpdatedAt())
            .build();
    }
}
