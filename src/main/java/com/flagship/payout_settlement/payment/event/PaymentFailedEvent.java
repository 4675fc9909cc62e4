package com.flagship.payout_settlement.payment.event;

import com.flagship.payout_settlement.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a payment moves to FAILED, either through a company
 * dispute or a rejected settlement. {@code failureKind} tells them apart.
 */
@Value
public class PaymentFailedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID creatorId;
    UUID companyId;
    BigDecimal netAmount;
    String failureKind;
    String failureReason;
    String previousStatus;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentFailedEvent fromPayment(Payment payment, String previousStatus) {
        return new PaymentFailedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getCreatorId(),
            payment.getCompanyId(),
            payment.getNetAmount(),
            payment.getFailure() != null ? payment.getFailure().getKind().name() : null,
            payment.getFailure() != null ? payment.getFailure().getReason() : null,
            previousStatus,
            Instant.now()
        );
    }
}
