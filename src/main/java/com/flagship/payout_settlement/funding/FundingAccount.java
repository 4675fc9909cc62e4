package com.flagship.payout_settlement.funding;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A platform account that payouts are funded from.
 */
@Value
@Builder(toBuilder = true)
public class FundingAccount {
    UUID id;
    String name;
    FundingAccountType type;
    String last4;
    FundingAccountStatus status;
    boolean primary;
    String bankName;
    String accountHolderName;
    String walletNetwork;
    String notes;
    Instant createdAt;
    Instant updatedAt;
}
