package com.flagship.payout_settlement.payment;

import com.flagship.payout_settlement.fee.FeeCalculator;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Builds payments with real fee breakdowns for tests.
 */
public final class PaymentFixtures {

    private static final FeeCalculator FEES = new FeeCalculator();

    private PaymentFixtures() {
    }

    public static Payment pending(String gross) {
        return pending(UUID.randomUUID(), UUID.randomUUID(), gross);
    }

    public static Payment pending(UUID creatorId, UUID companyId, String gross) {
        return Payment.create(UUID.randomUUID(), creatorId, companyId, UUID.randomUUID(),
            FEES.calculate(new BigDecimal(gross)), "Conversion payout");
    }

    public static Payment processing(String gross) {
        return pending(gross).approve();
    }
}
