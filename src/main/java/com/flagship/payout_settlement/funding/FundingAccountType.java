package com.flagship.payout_settlement.funding;

public enum FundingAccountType {
    BANK,
    WALLET,
    CARD
}
