package com.flagship.payout_settlement.notification;

/**
 * Situations that need a human to act on a payout.
 */
public enum EscalationType {
    /** A company disputed the payment; sent to the creator. */
    DISPUTED,
    /** The funding account cannot cover the payout; sent to the owning company. */
    INSUFFICIENT_FUNDS,
    BELOW_MINIMUM,
    SETTLEMENT_FAILED
}
