package com.flagship.payout_settlement.payment.exception;

import com.flagship.payout_settlement.payment.FailureKind;

import java.util.UUID;

/**
 * Any settlement failure that is neither a funding shortfall nor a minimum
 * amount violation: rail rejections, timeouts, unusable payout methods.
 */
public class GenericSettlementException extends SettlementException {

    public GenericSettlementException(UUID paymentId, String message) {
        super(paymentId, FailureKind.OTHER, message);
    }
}
