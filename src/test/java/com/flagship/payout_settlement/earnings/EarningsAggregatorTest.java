package com.flagship.payout_settlement.earnings;

import com.flagship.payout_settlement.method.PayoutMethodType;
import com.flagship.payout_settlement.payment.FailureKind;
import com.flagship.payout_settlement.payment.Payment;
import com.flagship.payout_settlement.payment.PaymentFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EarningsAggregatorTest {

    private final EarningsAggregator aggregator = new EarningsAggregator();

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(new BigDecimal(expected), actual, "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Each status lands in its own bucket and total excludes disputes")
    void bucketsByStatus() {
        Payment pending = PaymentFixtures.pending("100.00");
        Payment processing = PaymentFixtures.processing("200.00");
        Payment completed = PaymentFixtures.processing("300.00").complete(PayoutMethodType.PAYPAL, "tx");
        Payment disputed = PaymentFixtures.pending("400.00").dispute("Fake traffic");

        EarningsSummary summary = aggregator.summarize(
            List.of(pending, processing, completed, disputed), AmountBasis.GROSS);

        assertEquals(AmountBasis.GROSS, summary.getBasis());
        assertAmount("100.00", summary.getPendingEarnings());
        assertAmount("200.00", summary.getProcessingEarnings());
        assertAmount("300.00", summary.getCompletedEarnings());
        assertAmount("400.00", summary.getDisputedEarnings());
        assertAmount("600.00", summary.getTotalEarnings());
    }

    @Test
    @DisplayName("Creator view sums net amounts")
    void netBasis() {
        EarningsSummary summary = aggregator.summarize(
            List.of(PaymentFixtures.pending("100.00"), PaymentFixtures.processing("50.00")), AmountBasis.NET);

        assertAmount("93.00", summary.getPendingEarnings());
        assertAmount("46.50", summary.getProcessingEarnings());
        assertAmount("139.50", summary.getTotalEarnings());
    }

    @Test
    @DisplayName("Operational failures and refunds are not earnings")
    void failuresAndRefundsIgnored() {
        Payment failed = PaymentFixtures.processing("100.00")
            .fail(FailureKind.INSUFFICIENT_FUNDS, "Funding balance too low", PayoutMethodType.ETRANSFER);
        Payment refunded = PaymentFixtures.processing("100.00")
            .complete(PayoutMethodType.WIRE, "tx")
            .refund("Chargeback");
        Payment refundedDispute = PaymentFixtures.pending("100.00").dispute("Fraud").refund("Confirmed");

        EarningsSummary summary = aggregator.summarize(List.of(failed, refunded, refundedDispute), AmountBasis.GROSS);

        assertAmount("0.00", summary.getTotalEarnings());
        assertAmount("0.00", summary.getDisputedEarnings());
    }

    @Test
    @DisplayName("A released dispute counts as processing again")
    void releasedDisputeCountsAgain() {
        Payment released = PaymentFixtures.pending("80.00").dispute("Check").releaseDispute("Cleared");

        EarningsSummary summary = aggregator.summarize(List.of(released), AmountBasis.GROSS);

        assertAmount("80.00", summary.getProcessingEarnings());
        assertAmount("0.00", summary.getDisputedEarnings());
    }

    @Test
    @DisplayName("No payments gives zero in every bucket")
    void empty() {
        EarningsSummary summary = aggregator.summarize(List.of(), AmountBasis.NET);

        assertAmount("0.00", summary.getTotalEarnings());
        assertAmount("0.00", summary.getPendingEarnings());
        assertAmount("0.00", summary.getProcessingEarnings());
        assertAmount("0.00", summary.getCompletedEarnings());
        assertAmount("0.00", summary.getDisputedEarnings());
    }
}
