package com.flagship.payout_settlement.payment.exception;

import com.flagship.payout_settlement.payment.FailureKind;

import java.util.UUID;

public class BelowMinimumAmountException extends SettlementException {

    public BelowMinimumAmountException(UUID paymentId, String message) {
        super(paymentId, FailureKind.BELOW_MINIMUM_AMOUNT, message);
    }
}
