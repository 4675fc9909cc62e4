package com.flagship.payout_settlement.settlement.rail;

import com.flagship.payout_settlement.config.SettlementProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Simulated rail for development and demos. Every attempt succeeds; no money moves.
 */
@Component
@ConditionalOnProperty(name = "settlement.rail.sandbox", havingValue = "true", matchIfMissing = true)
@Slf4j
public class SandboxPaymentRail implements PaymentRail {

    private final SettlementProperties.Rail config;

    public SandboxPaymentRail(SettlementProperties properties) {
        this.config = properties.getRail();
    }

    @Override
    public RailResult attempt(RailRequest request) {
        String transactionId = "sandbox_" + UUID.randomUUID();
        log.info("[SANDBOX] Simulated {} payout of {} to {}: {}",
            request.getMethod(), request.getAmount(), request.getDestination(), transactionId);
        return RailResult.success(transactionId);
    }

    @Override
    public Optional<BigDecimal> availableBalance() {
        return Optional.ofNullable(config.getSandboxBalance());
    }
}
