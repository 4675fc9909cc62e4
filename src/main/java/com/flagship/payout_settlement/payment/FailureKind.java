package com.flagship.payout_settlement.payment;

/**
 * Why a payment ended up in {@link PaymentStatus#FAILED}.
 */
public enum FailureKind {
    /**
     * Company-initiated hold. Excluded from earnings and never retried automatically.
     */
    DISPUTED,
    INSUFFICIENT_FUNDS,
    BELOW_MINIMUM_AMOUNT,
    OTHER;

    public boolean isDispute() {
        return this == DISPUTED;
    }
}
