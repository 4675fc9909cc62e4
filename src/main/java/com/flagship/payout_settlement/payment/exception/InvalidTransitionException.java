package com.flagship.payout_settlement.payment.exception;

import com.flagship.payout_settlement.payment.PaymentStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * The requested status change is not an edge of the payment state graph
 * (or is an edge the payment's failure kind forbids, e.g. retrying a dispute).
 */
@Getter
public class InvalidTransitionException extends PayoutException {

    private final UUID paymentId;
    private final PaymentStatus currentStatus;
    private final PaymentStatus targetStatus;

    public InvalidTransitionException(UUID paymentId, PaymentStatus currentStatus,
                                      PaymentStatus targetStatus, String message) {
        super(message);
        this.paymentId = paymentId;
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }

    public InvalidTransitionException(UUID paymentId, PaymentStatus currentStatus, PaymentStatus targetStatus) {
        this(paymentId, currentStatus, targetStatus,
            String.format("Cannot move payment %s from %s to %s", paymentId, currentStatus, targetStatus));
    }
}
