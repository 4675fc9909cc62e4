package com.flagship.payout_settlement.observability;

import com.flagship.payout_settlement.payment.FailureKind;
import com.flagship.payout_settlement.payment.PaymentStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer metrics for the payout lifecycle.
 *
 * Metrics exposed:
 * - payout.recorded: payments recorded at intake
 * - payout.transitions: status changes, tagged from/to
 * - payout.settlement: settlement outcomes, tagged result and failure kind
 * - payout.settlement.duration: time spent in one settle call
 * - payout.cas.conflicts: compare-and-set misses
 * - payout.escalations: escalations dispatched, tagged type and outcome
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    private final Counter paymentsRecorded;
    private final Counter casConflicts;
    private final Timer settlementTimer;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.paymentsRecorded = Counter.builder("payout.recorded")
                .description("Number of payments recorded as pending")
                .register(registry);

        this.casConflicts = Counter.builder("payout.cas.conflicts")
                .description("Status writes rejected because the payment had moved on")
                .register(registry);

        this.settlementTimer = Timer.builder("payout.settlement.duration")
                .description("Time taken by a single settlement attempt")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordPaymentRecorded(boolean requiresReview) {
        paymentsRecorded.increment();
        if (requiresReview) {
            registry.counter("payout.recorded.review_required").increment();
        }
    }

    public void recordTransition(PaymentStatus from, PaymentStatus to) {
        registry.counter("payout.transitions",
                "from", from.name(),
                "to", to.name()
        ).increment();
    }

    public void recordConflict() {
        casConflicts.increment();
    }

    public void recordSettlement(String result, FailureKind failureKind) {
        registry.counter("payout.settlement",
                "result", result,
                "failure_kind", failureKind != null ? failureKind.name() : "none"
        ).increment();
    }

    public void recordSettlementDuration(Duration duration) {
        settlementTimer.record(duration);
    }

    public void recordBulkSettlement(int succeeded, int failed) {
        registry.counter("payout.settlement.bulk.items", "result", "succeeded").increment(succeeded);
        registry.counter("payout.settlement.bulk.items", "result", "failed").increment(failed);
    }

    public void recordEscalation(String type, boolean delivered) {
        registry.counter("payout.escalations",
                "type", type,
                "outcome", delivered ? "sent" : "failed"
        ).increment();
    }
}
