package com.flagship.payout_settlement.payment.exception;

import com.flagship.payout_settlement.payment.FailureKind;

import java.util.UUID;

public class InsufficientFundsException extends SettlementException {

    public InsufficientFundsException(UUID paymentId, String message) {
        super(paymentId, FailureKind.INSUFFICIENT_FUNDS, message);
    }
}
