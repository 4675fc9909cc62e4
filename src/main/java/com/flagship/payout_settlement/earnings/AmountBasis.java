package com.flagship.payout_settlement.earnings;

import com.flagship.payout_settlement.payment.Payment;

import java.math.BigDecimal;

/**
 * Which amount an earnings view sums: creators see what they take home,
 * companies and the platform see what was charged.
 */
public enum AmountBasis {
    NET,
    GROSS;

    BigDecimal amountOf(Payment payment) {
        return this == NET ? payment.getNetAmount() : payment.getGrossAmount();
    }
}
