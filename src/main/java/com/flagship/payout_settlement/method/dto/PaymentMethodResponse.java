package com.flagship.payout_settlement.method.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_settlement.method.PaymentMethod;
import com.flagship.payout_settlement.method.PaymentMethodState;
import com.flagship.payout_settlement.method.PayoutMethodType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for a payout method. Account details are masked.
 */
@Value
@Builder
public class PaymentMethodResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    PayoutMethodType type;

    @JsonProperty("destination")
    String destination;

    @JsonProperty("is_default")
    boolean defaultMethod;

    @JsonProperty("state")
    PaymentMethodState state;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PaymentMethodResponse from(PaymentMethod method) {
        return PaymentMethodResponse.builder()
            .id(method.getId())
            .type(method.getType())
            .destination(method.getMaskedDestination())
            .defaultMethod(method.isDefault())
            .state(method.getState())
            .createdAt(method.getCreatedAt())
            .build();
    }
}
