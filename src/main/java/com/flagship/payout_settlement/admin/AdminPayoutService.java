package com.flagship.payout_settlement.admin;

import com.flagship.payout_settlement.dispute.DisputeManager;
import com.flagship.payout_settlement.dispute.DisputeResolution;
import com.flagship.payout_settlement.earnings.AmountBasis;
import com.flagship.payout_settlement.earnings.EarningsAggregator;
import com.flagship.payout_settlement.earnings.EarningsSummary;
import com.flagship.payout_settlement.payment.Payment;
import com.flagship.payout_settlement.payment.PaymentFilter;
import com.flagship.payout_settlement.payment.PaymentIntakeService;
import com.flagship.payout_settlement.payment.PaymentRecordStore;
import com.flagship.payout_settlement.payment.PaymentTransitionService;
import com.flagship.payout_settlement.payment.RecordPaymentCommand;
import com.flagship.payout_settlement.payment.exception.SettlementException;
import com.flagship.payout_settlement.settlement.BulkSettlementResult;
import com.flagship.payout_settlement.settlement.SettlementOutcome;
import com.flagship.payout_settlement.settlement.SettlementProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Platform admin capabilities: intake, platform-wide views, settlement,
 * retry, refund and dispute resolution.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminPayoutService {

    private final PaymentIntakeService intake;
    private final PaymentRecordStore store;
    private final PaymentTransitionService transitions;
    private final SettlementProcessor settlement;
    private final DisputeManager disputes;
    private final EarningsAggregator earnings;

    public Payment recordPayment(RecordPaymentCommand command) {
        return intake.record(command);
    }

    public Payment getPayment(UUID paymentId) {
        return transitions.load(paymentId);
    }

    public List<Payment> listPayments(PaymentFilter filter) {
        return store.findAll(filter);
    }

    public List<Payment> listDisputed() {
        return store.findAll(PaymentFilter.builder().disputedOnly(true).build());
    }

    public EarningsSummary getPlatformEarnings() {
        return earnings.summarize(store.findAll(PaymentFilter.all()), AmountBasis.GROSS);
    }

    public Payment approve(UUID paymentId) {
        Payment payment = transitions.load(paymentId);
        return transitions.apply(payment, Payment::approve);
    }

    /**
     * Settles one payment. A persisted failure is rethrown as the matching
     * {@link SettlementException} so the caller sees the classified cause.
     */
    public SettlementOutcome settle(UUID paymentId) {
        SettlementOutcome outcome = settlement.settle(paymentId);
        if (outcome.getResult() == SettlementOutcome.Result.FAILED) {
            throw SettlementException.of(paymentId, outcome.getFailureKind(), outcome.getMessage());
        }
        return outcome;
    }

    public BulkSettlementResult settleAll(PaymentFilter filter) {
        return settlement.settleAll(filter);
    }

    public Payment retry(UUID paymentId) {
        return settlement.retry(paymentId);
    }

    public Payment refund(UUID paymentId, String reason) {
        return settlement.refund(paymentId, reason);
    }

    public Payment resolveDispute(UUID paymentId, DisputeResolution resolution, String notes) {
        return disputes.resolveDispute(paymentId, resolution, notes);
    }
}
