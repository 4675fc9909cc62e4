package com.flagship.payout_settlement.dispute;

/**
 * Admin decision on a disputed payment.
 */
public enum DisputeResolution {
    /** The company is right: money goes back, payment becomes REFUNDED. */
    REFUND,
    /** The creator is right: payment returns to PROCESSING and is paid on the next settlement. */
    RELEASE
}
