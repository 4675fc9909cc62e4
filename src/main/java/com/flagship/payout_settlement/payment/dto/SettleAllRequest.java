package com.flagship.payout_settlement.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_settlement.payment.PaymentFilter;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Optional narrowing of a bulk settlement. Only PROCESSING payments are ever selected.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SettleAllRequest {

    @JsonProperty("creator_id")
    private UUID creatorId;

    @JsonProperty("company_id")
    private UUID companyId;

    @JsonProperty("offer_id")
    private UUID offerId;

    @JsonProperty("search")
    private String search;

    public PaymentFilter toFilter() {
        return PaymentFilter.builder()
            .creatorId(creatorId)
            .companyId(companyId)
            .offerId(offerId)
            .search(search)
            .build();
    }
}
