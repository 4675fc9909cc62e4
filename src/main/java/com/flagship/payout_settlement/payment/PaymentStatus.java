package com.flagship.payout_settlement.payment;

import java.util.EnumSet;
import java.util.Set;

/**
 * Payment status enum representing where a creator payout is in its lifecycle.
 *
 * Status fields are not "just columns": the legal edges are declared here and
 * every write in {@link PaymentTransitionService} is checked against them.
 *
 * <pre>
 * PENDING    -> PROCESSING | FAILED
 * PROCESSING -> COMPLETED  | FAILED
 * FAILED     -> PROCESSING | REFUNDED   (retry, dispute resolution)
 * COMPLETED  -> REFUNDED                (admin refund)
 * REFUNDED   -> (none)
 * </pre>
 */
public enum PaymentStatus {
    /**
     * Recorded by the eligibility process, waiting for company or admin approval.
     */
    PENDING,

    /**
     * Approved and waiting for (or undergoing) settlement against the payment rail.
     */
    PROCESSING,

    /**
     * Money has been disbursed. No settlement path leaves this state;
     * only an explicit admin refund can.
     */
    COMPLETED,

    /**
     * Disputed by the company or rejected at settlement time.
     * Operational failures can be retried; disputes need admin resolution.
     */
    FAILED,

    /**
     * Money returned to the company. Terminal.
     */
    REFUNDED;

    private static final Set<PaymentStatus> SETTLEABLE = EnumSet.of(PENDING, PROCESSING);

    /**
     * Checks whether the state graph has an edge from this status to the target.
     */
    public boolean canTransitionTo(PaymentStatus target) {
        return switch (this) {
            case PENDING -> target == PROCESSING || target == FAILED;
            case PROCESSING -> target == COMPLETED || target == FAILED;
            case FAILED -> target == PROCESSING || target == REFUNDED;
            case COMPLETED -> target == REFUNDED;
            case REFUNDED -> false;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == REFUNDED;
    }

    /**
     * Statuses from which a company may dispute or an admin may settle.
     */
    public boolean isSettleable() {
        return SETTLEABLE.contains(this);
    }
}
