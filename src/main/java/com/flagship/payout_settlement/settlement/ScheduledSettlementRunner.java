package com.flagship.payout_settlement.settlement;

import com.flagship.payout_settlement.observability.CorrelationContext;
import com.flagship.payout_settlement.payment.PaymentFilter;
import com.flagship.payout_settlement.settings.PlatformSettingsStore;
import com.flagship.payout_settlement.settings.SettlementSchedule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Automatic disbursement. The cron fires daily; whether a run actually settles
 * anything depends on the admin settings {@code payment_auto_disburse} and
 * {@code payment_settlement_schedule}.
 */
@Component
@ConditionalOnProperty(name = "settlement.auto-disburse.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ScheduledSettlementRunner {

    private final SettlementProcessor processor;
    private final PlatformSettingsStore settings;

    @Scheduled(cron = "${settlement.auto-disburse.cron:0 0 6 * * *}", zone = "UTC")
    public void run() {
        runFor(LocalDate.now(ZoneOffset.UTC));
    }

    Optional<BulkSettlementResult> runFor(LocalDate today) {
        if (!settings.isAutoDisburseEnabled()) {
            log.debug("Auto-disburse is off, skipping scheduled settlement");
            return Optional.empty();
        }
        SettlementSchedule schedule = settings.getSettlementSchedule();
        if (!schedule.isDue(today)) {
            log.debug("Scheduled settlement not due today ({})", schedule);
            return Optional.empty();
        }

        CorrelationContext.setCorrelationId("auto-" + CorrelationContext.generateCorrelationId());
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        try {
            BulkSettlementResult result = processor.settleAll(PaymentFilter.all());
            log.info("Scheduled {} settlement: total={}, succeeded={}, failed={}",
                schedule, result.getTotal(), result.getSucceeded(), result.getFailed());
            return Optional.of(result);
        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }
}
