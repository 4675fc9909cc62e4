package com.flagship.payout_settlement.method;

/**
 * Whether a registered payout method can be used for settlement.
 */
public enum PaymentMethodState {
    /**
     * Required type-specific fields are missing.
     */
    INCOMPLETE,

    /**
     * E-transfer registered but onboarding with the rail has not finished
     * (no external account attached yet).
     */
    SETUP_REQUIRED,

    READY;

    public boolean isUsable() {
        return this == READY;
    }
}
