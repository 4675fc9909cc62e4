package com.flagship.payout_settlement.payment.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class PaymentNotFoundException extends NotFoundException {

    private final UUID paymentId;

    public PaymentNotFoundException(UUID paymentId) {
        super("Payment not found: " + paymentId);
        this.paymentId = paymentId;
    }
}
