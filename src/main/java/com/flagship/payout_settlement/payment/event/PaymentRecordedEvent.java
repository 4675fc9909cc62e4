package com.flagship.payout_settlement.payment.event;

import com.flagship.payout_settlement.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a payment is recorded as PENDING with its fee breakdown.
 */
@Value
public class PaymentRecordedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID creatorId;
    UUID companyId;
    UUID offerId;
    BigDecimal grossAmount;
    BigDecimal platformFeeAmount;
    BigDecimal processingFeeAmount;
    BigDecimal netAmount;
    boolean requiresReview;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentRecordedEvent fromPayment(Payment payment) {
        return new PaymentRecordedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getCreatorId(),
            payment.getCompanyId(),
            payment.getOfferId(),
            payment.getGrossAmount(),
            payment.getPlatformFeeAmount(),
            payment.getProcessingFeeAmount(),
            payment.getNetAmount(),
            payment.isRequiresReview(),
            Instant.now()
        );
    }
}
