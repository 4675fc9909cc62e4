package com.flagship.payout_settlement.settlement;

import com.flagship.payout_settlement.payment.FailureKind;
import com.flagship.payout_settlement.payment.Payment;
import lombok.Value;

import java.util.UUID;

/**
 * What happened to one payment in a settle call.
 */
@Value
public class SettlementOutcome {

    public enum Result {
        COMPLETED,
        /** The payment was already COMPLETED; the rail was not called. */
        ALREADY_COMPLETED,
        /** Settlement failed and the failure is persisted on the payment. */
        FAILED,
        /** Another writer changed the payment first; nothing was written. */
        CONFLICT
    }

    UUID paymentId;
    Result result;
    FailureKind failureKind;
    String message;
    Payment payment;

    public static SettlementOutcome completed(Payment payment) {
        return new SettlementOutcome(payment.getId(), Result.COMPLETED, null, null, payment);
    }

    public static SettlementOutcome alreadyCompleted(Payment payment) {
        return new SettlementOutcome(payment.getId(), Result.ALREADY_COMPLETED, null,
            "Payment was already completed", payment);
    }

    public static SettlementOutcome failed(Payment payment, FailureKind kind, String message) {
        return new SettlementOutcome(payment.getId(), Result.FAILED, kind, message, payment);
    }

    /**
     * Failure that could not be persisted on the payment (for example a database error mid-batch).
     */
    public static SettlementOutcome error(UUID paymentId, String message) {
        return new SettlementOutcome(paymentId, Result.FAILED, FailureKind.OTHER, message, null);
    }

    public static SettlementOutcome conflict(UUID paymentId, String message) {
        return new SettlementOutcome(paymentId, Result.CONFLICT, null, message, null);
    }

    /**
     * The payment left PROCESSING before this run reached it, for example a dispute
     * landed mid-batch. Carries the payment as re-read.
     */
    public static SettlementOutcome changed(Payment current, String message) {
        return new SettlementOutcome(current.getId(), Result.CONFLICT, null, message, current);
    }

    public boolean isSuccess() {
        return result == Result.COMPLETED || result == Result.ALREADY_COMPLETED;
    }
}
