package com.flagship.payout_settlement.payment.exception;

import com.flagship.payout_settlement.payment.PaymentStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * The conditional write lost: the payment's status changed between the read
 * and the compare-and-set.
 *
 * Callers must re-read the payment and decide again; blindly repeating the
 * same operation is never correct.
 */
@Getter
public class ConcurrencyConflictException extends PayoutException {

    private final UUID paymentId;
    private final PaymentStatus expectedStatus;
    private final PaymentStatus actualStatus;

    public ConcurrencyConflictException(UUID paymentId, PaymentStatus expectedStatus, PaymentStatus actualStatus) {
        super(String.format("Payment %s is no longer %s (found %s). Re-read the payment before retrying.",
            paymentId, expectedStatus, actualStatus));
        this.paymentId = paymentId;
        this.expectedStatus = expectedStatus;
        this.actualStatus = actualStatus;
    }
}
