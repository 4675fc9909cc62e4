package com.flagship.payout_settlement.settlement.rail;

import lombok.Value;

/**
 * Outcome reported by the payment rail for one disbursement attempt.
 */
@Value
public class RailResult {

    public enum Status {
        SUCCESS,
        INSUFFICIENT_FUNDS,
        BELOW_MINIMUM_AMOUNT,
        OTHER
    }

    Status status;
    String transactionId;
    String message;

    public static RailResult success(String transactionId) {
        return new RailResult(Status.SUCCESS, transactionId, null);
    }

    public static RailResult failure(Status status, String message) {
        if (status == Status.SUCCESS) {
            throw new IllegalArgumentException("Use RailResult.success for successful attempts");
        }
        return new RailResult(status, null, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
