package com.flagship.payout_settlement.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_settlement.method.PayoutMethodType;
import com.flagship.payout_settlement.payment.FailureKind;
import com.flagship.payout_settlement.payment.Payment;
import com.flagship.payout_settlement.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("creator_id")
    UUID creatorId;

    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("offer_id")
    UUID offerId;

    @JsonProperty("gross_amount")
    BigDecimal grossAmount;

    @JsonProperty("platform_fee_amount")
    BigDecimal platformFeeAmount;

    @JsonProperty("processing_fee_amount")
    BigDecimal processingFeeAmount;

    @JsonProperty("net_amount")
    BigDecimal netAmount;

    @JsonProperty("requires_review")
    boolean requiresReview;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("disputed")
    boolean disputed;

    @JsonProperty("failure_kind")
    FailureKind failureKind;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("payout_method")
    PayoutMethodType payoutMethod;

    @JsonProperty("description")
    String description;

    @JsonProperty("rail_transaction_id")
    String railTransactionId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("refunded_at")
    Instant refundedAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .creatorId(payment.getCreatorId())
            .companyId(payment.getCompanyId())
            .offerId(payment.getOfferId())
            .grossAmount(payment.getGrossAmount())
            .platformFeeAmount(payment.getPlatformFeeAmount())
            .processingFeeAmount(payment.getProcessingFeeAmount())
            .netAmount(payment.getNetAmount())
            .requiresReview(payment.isRequiresReview())
            .status(payment.getStatus())
            .disputed(payment.isDisputed())
            .failureKind(payment.getFailure() != null ? payment.getFailure().getKind() : null)
            .failureReason(payment.getFailure() != null ? payment.getFailure().getReason() : null)
            .payoutMethod(payment.getPayoutMethod())
            .description(payment.getDescription())
            .railTransactionId(payment.getRailTransactionId())
            .createdAt(payment.getCreatedAt())
            .updatedAt(payment.getUpdatedAt())
            .completedAt(payment.getCompletedAt())
            .refundedAt(payment.getRefundedAt())
            .build();
    }
}
