package com.flagship.payout_settlement.payment;

import lombok.Value;

/**
 * Classified failure carried by a FAILED payment.
 *
 * A dispute is recorded as {@code kind == DISPUTED}; nothing ever inspects the
 * free-text description to tell disputes from operational failures.
 */
@Value
public class PaymentFailure {
    FailureKind kind;
    String reason;

    public static PaymentFailure disputed(String reason) {
        return new PaymentFailure(FailureKind.DISPUTED, reason);
    }

    public static PaymentFailure settlement(FailureKind kind, String reason) {
        if (kind == FailureKind.DISPUTED) {
            throw new IllegalArgumentException("Disputes are raised through PaymentFailure.disputed()");
        }
        return new PaymentFailure(kind, reason);
    }

    public boolean isDispute() {
        return kind.isDispute();
    }
}
