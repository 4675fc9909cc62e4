package com.flagship.payout_settlement.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_settlement.payment.FailureKind;
import com.flagship.payout_settlement.settlement.SettlementOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SettlementOutcomeResponse {

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("result")
    SettlementOutcome.Result result;

    @JsonProperty("success")
    boolean success;

    @JsonProperty("failure_kind")
    FailureKind failureKind;

    @JsonProperty("message")
    String message;

    @JsonProperty("payment")
    PaymentResponse payment;

    public static SettlementOutcomeResponse from(SettlementOutcome outcome) {
        return SettlementOutcomeResponse.builder()
            .paymentId(outcome.getPaymentId())
            .result(outcome.getResult())
            .success(outcome.isSuccess())
            .failureKind(outcome.getFailureKind())
            .message(outcome.getMessage())
            .payment(outcome.getPayment() != null ? PaymentResponse.from(outcome.getPayment()) : null)
            .build();
    }
}
