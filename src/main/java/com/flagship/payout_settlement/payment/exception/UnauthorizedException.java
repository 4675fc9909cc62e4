package com.flagship.payout_settlement.payment.exception;

import java.util.UUID;

/**
 * The acting company or creator does not own the record it tried to act on.
 */
public class UnauthorizedException extends PayoutException {

    public UnauthorizedException(String message) {
        super(message);
    }

    public static UnauthorizedException notPaymentOwner(UUID paymentId, UUID actorId) {
        return new UnauthorizedException(
            String.format("Actor %s is not allowed to act on payment %s", actorId, paymentId));
    }
}
