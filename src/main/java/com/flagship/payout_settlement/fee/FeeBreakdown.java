package com.flagship.payout_settlement.fee;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Fee split stamped onto a payment once, at intake.
 *
 * netAmount is clamped at zero; when clamping happened {@code requiresReview}
 * is true and the payment is flagged for manual review.
 */
@Value
public class FeeBreakdown {
    BigDecimal grossAmount;
    BigDecimal platformFeeRate;
    BigDecimal platformFeeAmount;
    BigDecimal processingFeeAmount;
    BigDecimal netAmount;
    boolean requiresReview;

    public BigDecimal getTotalFees() {
        return platformFeeAmount.add(processingFeeAmount);
    }
}
