package com.flagship.payout_settlement.payment.exception;

import com.flagship.payout_settlement.payment.FailureKind;
import lombok.Getter;

import java.util.UUID;

/**
 * A settlement attempt failed and the failure has already been persisted on
 * the payment (status FAILED with the classified kind).
 */
@Getter
public abstract class SettlementException extends PayoutException {

    private final UUID paymentId;
    private final FailureKind failureKind;

    protected SettlementException(UUID paymentId, FailureKind failureKind, String message) {
        super(message);
        this.paymentId = paymentId;
        this.failureKind = failureKind;
    }

    /**
     * Maps a persisted failure classification to the exception reported to callers.
     */
    public static SettlementException of(UUID paymentId, FailureKind kind, String message) {
        return switch (kind) {
            case INSUFFICIENT_FUNDS -> new InsufficientFundsException(paymentId, message);
            case BELOW_MINIMUM_AMOUNT -> new BelowMinimumAmountException(paymentId, message);
            case OTHER, DISPUTED -> new GenericSettlementException(paymentId, message);
        };
    }
}
