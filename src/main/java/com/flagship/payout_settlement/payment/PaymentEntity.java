package com.flagship.payout_settlement.payment;

import com.flagship.payout_settlement.method.PayoutMethodType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for Payment persistence.
 *
 * Key design principles:
 * - No @Setter: the only write path for an existing row is the
 *   compare-and-set query in {@link PaymentRepository}
 * - Identity, parties and fee columns are updatable = false
 * - fromDomain() is the only way to create entities
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payments_creator", columnList = "creator_id"),
        @Index(name = "idx_payments_company", columnList = "company_id"),
        @Index(name = "idx_payments_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "creator_id", nullable = false, updatable = false)
    private UUID creatorId;

    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(name = "offer_id", updatable = false)
    private UUID offerId;

    @Column(name = "gross_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal grossAmount;

    @Column(name = "platform_fee_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal platformFeeAmount;

    @Column(name = "processing_fee_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal processingFeeAmount;

    @Column(name = "net_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal netAmount;

    @Column(name = "requires_review", nullable = false, updatable = false)
    private boolean requiresReview;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind", length = 30)
    private FailureKind failureKind;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "payout_method", length = 20)
    private PayoutMethodType payoutMethod;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "rail_transaction_id")
    private String railTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
    }

    static PaymentEntity fromDomain(Payment payment) {
        PaymentFailure failure = payment.getFailure();
        return new PaymentEntity(
            payment.getId(),
            payment.getCreatorId(),
            payment.getCompanyId(),
            payment.getOfferId(),
            payment.getGrossAmount(),
            payment.getPlatformFeeAmount(),
            payment.getProcessingFeeAmount(),
            payment.getNetAmount(),
            payment.isRequiresReview(),
            payment.getStatus(),
            failure != null ? failure.getKind() : null,
            failure != null ? failure.getReason() : null,
            payment.getPayoutMethod(),
            payment.getDescription(),
            payment.getRailTransactionId(),
            payment.getCreatedAt(),
            payment.getUpdatedAt(),
            payment.getCompletedAt(),
            payment.getRefundedAt()
        );
    }

    public Payment toDomain() {
        return Payment.builder()
            .id(id)
            .creatorId(creatorId)
            .companyId(companyId)
            .offerId(offerId)
            .grossAmount(grossAmount)
            .platformFeeAmount(platformFeeAmount)
            .processingFeeAmount(processingFeeAmount)
            .netAmount(netAmount)
            .requiresReview(requiresReview)
            .status(status)
            .failure(failureKind != null ? new PaymentFailure(failureKind, failureReason) : null)
            .payoutMethod(payoutMethod)
            .description(description)
            .railTransactionId(railTransactionId)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .completedAt(completedAt)
            .refundedAt(refundedAt)
            .build();
    }
}
