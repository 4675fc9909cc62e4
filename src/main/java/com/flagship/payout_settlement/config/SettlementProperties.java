package com.flagship.payout_settlement.config;

import com.flagship.payout_settlement.method.PayoutMethodType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Settlement configuration bound from the {@code settlement.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {

    /**
     * Smallest net amount each rail will disburse. A method with no entry cannot be settled.
     */
    private Map<PayoutMethodType, BigDecimal> minimumAmounts = new EnumMap<>(PayoutMethodType.class);

    private Rail rail = new Rail();

    private AutoDisburse autoDisburse = new AutoDisburse();

    @Data
    public static class Rail {
        /**
         * When true, payouts are simulated and no money moves.
         */
        private boolean sandbox = true;
        private String baseUrl;
        private String apiKey;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
        /**
         * Balance the sandbox rail reports; unset means "unknown" and skips the balance check.
         */
        private BigDecimal sandboxBalance;
    }

    @Data
    public static class AutoDisburse {
        private boolean enabled = false;
        private String cron = "0 0 6 * * *";
    }
}
