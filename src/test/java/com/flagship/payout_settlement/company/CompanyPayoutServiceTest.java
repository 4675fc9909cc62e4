package com.flagship.payout_settlement.company;

import com.flagship.payout_settlement.dispute.DisputeManager;
import com.flagship.payout_settlement.earnings.AmountBasis;
import com.flagship.payout_settlement.earnings.EarningsAggregator;
import com.flagship.payout_settlement.earnings.EarningsSummary;
import com.flagship.payout_settlement.notification.EscalationDispatcher;
import com.flagship.payout_settlement.observability.SettlementMetrics;
import com.flagship.payout_settlement.outbox.OutboxService;
import com.flagship.payout_settlement.payment.InMemoryPaymentRecordStore;
import com.flagship.payout_settlement.payment.Payment;
import com.flagship.payout_settlement.payment.PaymentFilter;
import com.flagship.payout_settlement.payment.PaymentFixtures;
import com.flagship.payout_settlement.payment.PaymentStatus;
import com.flagship.payout_settlement.payment.PaymentTransitionService;
import com.flagship.payout_settlement.payment.exception.InvalidTransitionException;
import com.flagship.payout_settlement.payment.exception.UnauthorizedException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class CompanyPayoutServiceTest {

    private InMemoryPaymentRecordStore store;
    private PaymentTransitionService transitions;
    private CompanyPayoutService service;

    private UUID companyId;

    @BeforeEach
    void setUp() {
        store = new InMemoryPaymentRecordStore();
        transitions = new PaymentTransitionService(store, mock(OutboxService.class),
            new SettlementMetrics(new SimpleMeterRegistry()));
        DisputeManager disputes = new DisputeManager(transitions, mock(EscalationDispatcher.class));
        service = new CompanyPayoutService(store, transitions, disputes, new EarningsAggregator());
        companyId = UUID.randomUUID();
    }

    private Payment record(UUID company, String gross) {
        return transitions.record(PaymentFixtures.pending(UUID.randomUUID(), company, gross));
    }

    @Test
    @DisplayName("Company approves its own pending payment")
    void approveOwnPayment() {
        Payment payment = record(companyId, "80.00");

        Payment approved = service.approve(companyId, payment.getId());

        assertEquals(PaymentStatus.PROCESSING, approved.getStatus());
        assertEquals(PaymentStatus.PROCESSING, store.findById(payment.getId()).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Approving another company's payment is forbidden and changes nothing")
    void approveOthersPayment() {
        Payment payment = record(UUID.randomUUID(), "80.00");

        assertThrows(UnauthorizedException.class, () -> service.approve(companyId, payment.getId()));
        assertEquals(PaymentStatus.PENDING, store.findById(payment.getId()).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Only pending payments can be approved")
    void approveTwice() {
        Payment payment = record(companyId, "80.00");
        service.approve(companyId, payment.getId());

        assertThrows(InvalidTransitionException.class, () -> service.approve(companyId, payment.getId()));
    }

    @Test
    @DisplayName("Listings and totals only cover the company's own payments, on gross amounts")
    void scopedToCompany() {
        record(companyId, "100.00");
        Payment second = record(companyId, "50.00");
        record(UUID.randomUUID(), "999.00");
        service.approve(companyId, second.getId());

        List<Payment> all = service.listPayments(companyId, PaymentFilter.all());
        List<Payment> processing = service.listPayments(companyId,
            PaymentFilter.builder().statuses(Set.of(PaymentStatus.PROCESSING)).build());
        EarningsSummary summary = service.getEarningsSummary(companyId);

        assertEquals(2, all.size());
        assertEquals(List.of(second.getId()), processing.stream().map(Payment::getId).toList());
        assertEquals(AmountBasis.GROSS, summary.getBasis());
        assertEquals(0, new BigDecimal("150.00").compareTo(summary.getTotalEarnings()));
        assertEquals(0, new BigDecimal("50.00").compareTo(summary.getProcessingEarnings()));
    }

    @Test
    @DisplayName("Dispute goes through the dispute manager with the company as actor")
    void dispute() {
        Payment payment = record(companyId, "80.00");

        Payment disputed = service.dispute(companyId, payment.getId(), "Customer cancelled");

        assertTrue(disputed.isDisputed());
        assertThrows(UnauthorizedException.class,
            () -> service.dispute(UUID.randomUUID(), record(companyId, "10.00").getId(), "Not ours"));
    }
}
