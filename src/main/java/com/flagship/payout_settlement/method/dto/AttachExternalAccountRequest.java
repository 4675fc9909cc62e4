package com.flagship.payout_settlement.method.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AttachExternalAccountRequest {

    @NotBlank(message = "External account ID is required")
    @JsonProperty("external_account_id")
    private String externalAccountId;
}
