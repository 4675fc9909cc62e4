package com.flagship.payout_settlement.payment.exception;

/**
 * Base type for every failure the payout subsystem reports to its callers.
 *
 * All subtypes are unchecked; the REST layer maps them to HTTP responses in
 * {@link GlobalExceptionHandler}.
 */
public abstract class PayoutException extends RuntimeException {

    protected PayoutException(String message) {
        super(message);
    }

    protected PayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
