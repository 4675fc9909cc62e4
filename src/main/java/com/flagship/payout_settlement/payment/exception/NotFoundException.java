package com.flagship.payout_settlement.payment.exception;

public class NotFoundException extends PayoutException {

    public NotFoundException(String message) {
        super(message);
    }
}
