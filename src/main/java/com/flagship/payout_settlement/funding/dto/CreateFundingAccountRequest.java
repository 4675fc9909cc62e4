package com.flagship.payout_settlement.funding.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_settlement.funding.FundingAccountStatus;
import com.flagship.payout_settlement.funding.FundingAccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateFundingAccountRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    private String name;

    @NotNull(message = "Type is required")
    @JsonProperty("type")
    private FundingAccountType type;

    @NotBlank(message = "Last four digits are required")
    @JsonProperty("last4")
    private String last4;

    @JsonProperty("status")
    private FundingAccountStatus status;

    @JsonProperty("bank_name")
    private String bankName;

    @JsonProperty("account_holder_name")
    private String accountHolderName;

    @JsonProperty("wallet_network")
    private String walletNetwork;

    @JsonProperty("notes")
    private String notes;
}
