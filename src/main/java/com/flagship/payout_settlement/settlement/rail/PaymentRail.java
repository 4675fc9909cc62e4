package com.flagship.payout_settlement.settlement.rail;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * External money-movement provider.
 */
public interface PaymentRail {

    /**
     * Attempts one disbursement. Implementations report rail-side failures as a
     * {@link RailResult}; transport errors and timeouts are reported as
     * {@link RailResult.Status#OTHER}, never thrown.
     */
    RailResult attempt(RailRequest request);

    /**
     * Balance available in the platform's funding account, if the rail exposes it.
     */
    Optional<BigDecimal> availableBalance();
}
