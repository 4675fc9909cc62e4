package com.flagship.payout_settlement.funding.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_settlement.funding.FundingAccountStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateFundingAccountStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    private FundingAccountStatus status;
}
