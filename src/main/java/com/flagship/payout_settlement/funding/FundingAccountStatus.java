package com.flagship.payout_settlement.funding;

public enum FundingAccountStatus {
    ACTIVE,
    /** Added but not yet verified; cannot be primary. */
    PENDING,
    DISABLED
}
