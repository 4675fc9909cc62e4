package com.flagship.payout_settlement.payment.event;

import com.flagship.payout_settlement.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event for status changes that are neither a settlement nor a failure:
 * approval, retry, dispute release and refund.
 */
@Value
public class PaymentStatusChangedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    String eventType;
    String previousStatus;
    String newStatus;
    Instant occurredAt;

    public static final String APPROVED = "PaymentApproved";
    public static final String RETRIED = "PaymentRetried";
    public static final String DISPUTE_RELEASED = "PaymentDisputeReleased";
    public static final String REFUNDED = "PaymentRefunded";

    public static PaymentStatusChangedEvent of(String eventType, Payment payment, String previousStatus) {
        return new PaymentStatusChangedEvent(
            UUID.randomUUID(),
            payment.getId(),
            eventType,
            previousStatus,
            payment.getStatus().name(),
            Instant.now()
        );
    }
}
