package com.flagship.payout_settlement.earnings;

import com.flagship.payout_settlement.payment.Payment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Reduces a set of payments to earnings buckets in a single pass. Read-only.
 *
 * Disputed payments land only in the disputed bucket. Other FAILED payments
 * and REFUNDED payments are not counted anywhere.
 */
@Component
public class EarningsAggregator {

    public EarningsSummary summarize(Collection<Payment> payments, AmountBasis basis) {
        BigDecimal pending = BigDecimal.ZERO;
        BigDecimal processing = BigDecimal.ZERO;
        BigDecimal completed = BigDecimal.ZERO;
        BigDecimal disputed = BigDecimal.ZERO;

        for (Payment payment : payments) {
            BigDecimal amount = basis.amountOf(payment);
            if (payment.isDisputed()) {
                disputed = disputed.add(amount);
                continue;
            }
            switch (payment.getStatus()) {
                case PENDING -> pending = pending.add(amount);
                case PROCESSING -> processing = processing.add(amount);
                case COMPLETED -> completed = completed.add(amount);
                case FAILED, REFUNDED -> {
                    // not earned
                }
            }
        }

        BigDecimal total = pending.add(processing).add(completed);
        return new EarningsSummary(basis, money(total), money(pending), money(processing),
            money(completed), money(disputed));
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}
