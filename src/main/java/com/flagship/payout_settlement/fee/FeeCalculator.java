package com.flagship.payout_settlement.fee;

import com.flagship.payout_settlement.payment.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Computes the platform fee, processing fee and creator net for a gross amount.
 *
 * Pure: no I/O, no clock, no state. Every amount is rounded to cents with HALF_UP.
 */
@Component
@Slf4j
public class FeeCalculator {

    public static final BigDecimal DEFAULT_PLATFORM_FEE_RATE = new BigDecimal("0.04");
    public static final BigDecimal PROCESSING_FEE_RATE = new BigDecimal("0.03");
    public static final BigDecimal MAX_PLATFORM_FEE_RATE = BigDecimal.ONE;

    private static final int MONEY_SCALE = 2;

    /**
     * Calculates fees using the default platform rate.
     */
    public FeeBreakdown calculate(BigDecimal grossAmount) {
        return calculate(grossAmount, DEFAULT_PLATFORM_FEE_RATE);
    }

    /**
     * Calculates fees for a gross amount at the given platform rate.
     *
     * @param grossAmount amount the company owes, must be non-negative
     * @param platformFeeRate fraction between 0 and 1; null means the default 4%
     * @return breakdown with net clamped at zero and flagged for review when fees exceed gross
     * @throws ValidationException if the amount is missing or negative, or the rate is out of range
     */
    public FeeBreakdown calculate(BigDecimal grossAmount, BigDecimal platformFeeRate) {
        if (grossAmount == null) {
            throw new ValidationException("Gross amount is required");
        }
        if (grossAmount.signum() < 0) {
            throw new ValidationException("Gross amount cannot be negative: " + grossAmount);
        }
        BigDecimal rate = platformFeeRate != null ? platformFeeRate : DEFAULT_PLATFORM_FEE_RATE;
        validateRate(rate);

        BigDecimal gross = grossAmount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal platformFee = gross.multiply(rate).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal processingFee = gross.multiply(PROCESSING_FEE_RATE).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal net = gross.subtract(platformFee).subtract(processingFee);

        boolean clamped = false;
        if (net.signum() < 0) {
            log.warn("Fees exceed gross amount, clamping net to zero: gross={}, platformFee={}, processingFee={}",
                gross, platformFee, processingFee);
            net = BigDecimal.ZERO.setScale(MONEY_SCALE);
            clamped = true;
        }

        return new FeeBreakdown(gross, rate, platformFee, processingFee, net, clamped);
    }

    /**
     * Validates a per-company platform fee rate. Rates above 97% are accepted;
     * together with processing they exceed gross and the net is clamped.
     */
    public static void validateRate(BigDecimal rate) {
        if (rate.signum() < 0 || rate.compareTo(MAX_PLATFORM_FEE_RATE) > 0) {
            throw new ValidationException(
                "Platform fee rate must be between 0 and " + MAX_PLATFORM_FEE_RATE + ", got " + rate);
        }
    }
}
