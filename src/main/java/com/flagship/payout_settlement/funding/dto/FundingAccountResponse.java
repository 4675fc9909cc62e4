package com.flagship.payout_settlement.funding.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_settlement.funding.FundingAccount;
import com.flagship.payout_settlement.funding.FundingAccountStatus;
import com.flagship.payout_settlement.funding.FundingAccountType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class FundingAccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("type")
    FundingAccountType type;

    @JsonProperty("last4")
    String last4;

    @JsonProperty("status")
    FundingAccountStatus status;

    @JsonProperty("is_primary")
    boolean primary;

    @JsonProperty("bank_name")
    String bankName;

    @JsonProperty("wallet_network")
    String walletNetwork;

    @JsonProperty("created_at")
    Instant createdAt;

    public static FundingAccountResponse from(FundingAccount account) {
        return FundingAccountResponse.builder()
            .id(account.getId())
            .name(account.getName())
            .type(account.getType())
            .last4(account.getLast4())
            .status(account.getStatus())
            .primary(account.isPrimary())
            .bankName(account.getBankName())
            .walletNetwork(account.getWalletNetwork())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
