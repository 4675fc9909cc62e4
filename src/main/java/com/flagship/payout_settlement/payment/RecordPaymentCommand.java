package com.flagship.payout_settlement.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Input to payment intake. {@code platformFeeRate} is the company's negotiated
 * rate; null means the platform default.
 */
@Value
@Builder
public class RecordPaymentCommand {
    UUID creatorId;
    UUID companyId;
    UUID offerId;
    BigDecimal grossAmount;
    BigDecimal platformFeeRate;
    String description;
}
