package com.flagship.payout_settlement.payment.exception;

/**
 * Input rejected before any state was touched (empty dispute reason,
 * negative amount, missing payout fields...).
 */
public class ValidationException extends PayoutException {

    public ValidationException(String message) {
        super(message);
    }
}
