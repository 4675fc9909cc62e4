package com.flagship.payout_settlement.payment.event;

import com.flagship.payout_settlement.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a payout has been disbursed (PROCESSING to COMPLETED).
 */
@Value
public class PaymentSettledEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID creatorId;
    UUID companyId;
    BigDecimal netAmount;
    String payoutMethod;
    String railTransactionId;
    Instant completedAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentSettled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentSettledEvent fromPayment(Payment payment) {
        return new PaymentSettledEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getCreatorId(),
            payment.getCompanyId(),
            payment.getNetAmount(),
            payment.getPayoutMethod() != null ? payment.getPayoutMethod().name() : null,
            payment.getRailTransactionId(),
            payment.getCompletedAt(),
            Instant.now()
        );
    }
}
