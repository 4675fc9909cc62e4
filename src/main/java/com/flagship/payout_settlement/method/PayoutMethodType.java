package com.flagship.payout_settlement.method;

/**
 * Rails a creator can be paid out on.
 */
public enum PayoutMethodType {
    /**
     * Interac e-transfer, disbursed through a connected external account.
     */
    ETRANSFER,
    WIRE,
    PAYPAL,
    CRYPTO
}
