package com.flagship.payout_settlement.settlement;

import com.flagship.payout_settlement.config.SettlementProperties;
import com.flagship.payout_settlement.method.PayoutMethodType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Per-method minimum payout amounts. A method without a configured minimum
 * has no entry here; it is never treated as zero.
 */
@Component
@RequiredArgsConstructor
public class MinimumAmountPolicy {

    private final SettlementProperties properties;

    public Optional<BigDecimal> minimumFor(PayoutMethodType method) {
        return Optional.ofNullable(properties.getMinimumAmounts().get(method));
    }
}
