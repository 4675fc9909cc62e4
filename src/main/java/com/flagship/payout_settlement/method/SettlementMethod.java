package com.flagship.payout_settlement.method;

import lombok.Value;

import java.util.Optional;

/**
 * Result of looking up the method a creator will be paid with.
 * Either a usable method, or the reason there is none.
 */
@Value
public class SettlementMethod {
    PaymentMethod method;
    String unavailableReason;

    public static SettlementMethod usable(PaymentMethod method) {
        return new SettlementMethod(method, null);
    }

    public static SettlementMethod unavailable(PaymentMethod method, String reason) {
        return new SettlementMethod(method, reason);
    }

    public boolean isUsable() {
        return unavailableReason == null;
    }

    public Optional<PayoutMethodType> getType() {
        return Optional.ofNullable(method).map(PaymentMethod::getType);
    }
}
