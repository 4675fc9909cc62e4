package com.flagship.payout_settlement.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_settlement.dispute.DisputeResolution;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveDisputeRequest {

    @NotNull(message = "Resolution is required (REFUND or RELEASE)")
    @JsonProperty("resolution")
    private DisputeResolution resolution;

    @Size(max = 1000, message = "Notes are limited to 1000 characters")
    @JsonProperty("notes")
    private String notes;
}
