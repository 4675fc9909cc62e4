package com.flagship.payout_settlement.payment;

import com.flagship.payout_settlement.fee.FeeBreakdown;
import com.flagship.payout_settlement.method.PayoutMethodType;
import com.flagship.payout_settlement.payment.exception.InvalidTransitionException;
import com.flagship.payout_settlement.payment.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Creator payout record.
 *
 * Key principles:
 * - Status transitions are explicit and validated against {@link PaymentStatus}
 * - Invalid transitions are rejected with {@link InvalidTransitionException}
 * - State changes are immutable (each transition returns a new Payment)
 * - Fee fields are fixed at creation; no transition touches them
 */
@Value
@Builder(toBuilder = true)
public class Payment {
    UUID id;
    UUID creatorId;
    UUID companyId;
    UUID offerId;
    BigDecimal grossAmount;
    BigDecimal platformFeeAmount;
    BigDecimal processingFeeAmount;
    BigDecimal netAmount;
    boolean requiresReview;
    PaymentStatus status;
    PaymentFailure failure;
    PayoutMethodType payoutMethod;
    String description;
    String railTransactionId;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;
    Instant refundedAt;

    /**
     * Creates a new Payment in PENDING status, stamped with its fee breakdown.
     */
    public static Payment create(UUID id, UUID creatorId, UUID companyId, UUID offerId,
                                 FeeBreakdown fees, String description) {
        Instant now = Instant.now();
        return Payment.builder()
            .id(id)
            .creatorId(creatorId)
            .companyId(companyId)
            .offerId(offerId)
            .grossAmount(fees.getGrossAmount())
            .platformFeeAmount(fees.getPlatformFeeAmount())
            .processingFeeAmount(fees.getProcessingFeeAmount())
            .netAmount(fees.getNetAmount())
            .requiresReview(fees.isRequiresReview())
            .status(PaymentStatus.PENDING)
            .description(description)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Company or admin approval: PENDING to PROCESSING.
     */
    public Payment approve() {
        if (status != PaymentStatus.PENDING) {
            throw new InvalidTransitionException(id, status, PaymentStatus.PROCESSING,
                String.format("Cannot approve payment in %s status. Only PENDING payments can be approved.", status));
        }
        return moveTo(PaymentStatus.PROCESSING).build();
    }

    /**
     * Company dispute: PENDING or PROCESSING to FAILED, tagged as a dispute.
     */
    public Payment dispute(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Dispute reason is required");
        }
        if (!status.isSettleable()) {
            throw new InvalidTransitionException(id, status, PaymentStatus.FAILED,
                String.format("Cannot dispute payment in %s status. Only PENDING or PROCESSING payments can be disputed.",
                    status));
        }
        return moveTo(PaymentStatus.FAILED)
            .failure(PaymentFailure.disputed(reason.trim()))
            .description("Disputed: " + reason.trim())
            .build();
    }

    /**
     * Successful settlement: PROCESSING to COMPLETED.
     */
    public Payment complete(PayoutMethodType method, String railTransactionId) {
        if (status != PaymentStatus.PROCESSING) {
            throw new InvalidTransitionException(id, status, PaymentStatus.COMPLETED,
                String.format("Cannot complete payment in %s status. Only PROCESSING payments can be completed.", status));
        }
        Instant now = Instant.now();
        return moveTo(PaymentStatus.COMPLETED, now)
            .payoutMethod(method)
            .railTransactionId(railTransactionId)
            .completedAt(now)
            .build();
    }

    /**
     * Settlement failure: PENDING or PROCESSING to FAILED with a classified reason.
     */
    public Payment fail(FailureKind kind, String reason, PayoutMethodType method) {
        if (!status.isSettleable()) {
            throw new InvalidTransitionException(id, status, PaymentStatus.FAILED,
                String.format("Cannot fail payment in %s status. Only PENDING or PROCESSING payments can fail.", status));
        }
        return moveTo(PaymentStatus.FAILED)
            .failure(PaymentFailure.settlement(kind, reason))
            .payoutMethod(method != null ? method : payoutMethod)
            .build();
    }

    /**
     * Admin retry of an operational failure: FAILED to PROCESSING.
     * Disputed payments are excluded; they go through dispute resolution instead.
     */
    public Payment retry() {
        if (status != PaymentStatus.FAILED) {
            throw new InvalidTransitionException(id, status, PaymentStatus.PROCESSING,
                String.format("Cannot retry payment in %s status. Only FAILED payments can be retried.", status));
        }
        if (isDisputed()) {
            throw new InvalidTransitionException(id, status, PaymentStatus.PROCESSING,
                "Payment " + id + " is disputed and cannot be retried. Resolve the dispute instead.");
        }
        return moveTo(PaymentStatus.PROCESSING).failure(null).build();
    }

    /**
     * Admin dispute resolution in the creator's favour: disputed FAILED back to PROCESSING.
     */
    public Payment releaseDispute(String notes) {
        if (!isDisputed()) {
            throw new InvalidTransitionException(id, status, PaymentStatus.PROCESSING,
                "Payment " + id + " is not disputed");
        }
        return moveTo(PaymentStatus.PROCESSING)
            .failure(null)
            .description(appendNote(description, "Dispute released", notes))
            .build();
    }

    /**
     * Admin refund: COMPLETED, or a disputed FAILED payment, to REFUNDED.
     */
    public Payment refund(String reason) {
        boolean refundable = status == PaymentStatus.COMPLETED || isDisputed();
        if (!refundable) {
            throw new InvalidTransitionException(id, status, PaymentStatus.REFUNDED,
                String.format("Cannot refund payment in %s status. Only COMPLETED or disputed payments can be refunded.",
                    status));
        }
        Instant now = Instant.now();
        return moveTo(PaymentStatus.REFUNDED, now)
            .refundedAt(now)
            .description(appendNote(description, "Refunded", reason))
            .build();
    }

    public boolean isDisputed() {
        return status == PaymentStatus.FAILED && failure != null && failure.isDispute();
    }

    public boolean canTransitionTo(PaymentStatus target) {
        return status.canTransitionTo(target);
    }

    private PaymentBuilder moveTo(PaymentStatus target) {
        return moveTo(target, Instant.now());
    }

    private PaymentBuilder moveTo(PaymentStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target);
        }
        return toBuilder().status(target).updatedAt(at);
    }

    private static String appendNote(String description, String label, String note) {
        String entry = (note == null || note.isBlank()) ? label : label + ": " + note.trim();
        return (description == null || description.isBlank()) ? entry : description + " | " + entry;
    }
}
