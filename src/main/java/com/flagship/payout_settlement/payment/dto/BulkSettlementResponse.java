package com.flagship.payout_settlement.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_settlement.settlement.BulkSettlementResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BulkSettlementResponse {

    @JsonProperty("total")
    int total;

    @JsonProperty("succeeded")
    int succeeded;

    @JsonProperty("failed")
    int failed;

    @JsonProperty("results")
    List<SettlementOutcomeResponse> results;

    public static BulkSettlementResponse from(BulkSettlementResult result) {
        return BulkSettlementResponse.builder()
            .total(result.getTotal())
            .succeeded(result.getSucceeded())
            .failed(result.getFailed())
            .results(result.getOutcomes().stream().map(SettlementOutcomeResponse::from).toList())
            .build();
    }
}
