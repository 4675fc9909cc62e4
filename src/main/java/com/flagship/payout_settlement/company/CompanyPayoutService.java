package com.flagship.payout_settlement.company;

import com.flagship.payout_settlement.dispute.DisputeManager;
import com.flagship.payout_settlement.earnings.AmountBasis;
import com.flagship.payout_settlement.earnings.EarningsAggregator;
import com.flagship.payout_settlement.earnings.EarningsSummary;
import com.flagship.payout_settlement.payment.Payment;
import com.flagship.payout_settlement.payment.PaymentFilter;
import com.flagship.payout_settlement.payment.PaymentRecordStore;
import com.flagship.payout_settlement.payment.PaymentTransitionService;
import com.flagship.payout_settlement.payment.exception.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * What a company can do with the payouts it owes: list them, see totals,
 * approve pending ones and dispute them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompanyPayoutService {

    private final PaymentRecordStore store;
    private final PaymentTransitionService transitions;
    private final DisputeManager disputes;
    private final EarningsAggregator earnings;

    public List<Payment> listPayments(UUID companyId, PaymentFilter filter) {
        return store.findForCompany(companyId, filter);
    }

    /**
     * Company totals are what the company pays out, so gross amounts.
     */
    public EarningsSummary getEarningsSummary(UUID companyId) {
        return earnings.summarize(store.findForCompany(companyId, PaymentFilter.all()), AmountBasis.GROSS);
    }

    public Payment approve(UUID companyId, UUID paymentId) {
        Payment payment = transitions.load(paymentId);
        if (!payment.getCompanyId().equals(companyId)) {
            throw UnauthorizedException.notPaymentOwner(paymentId, companyId);
        }
        Payment approved = transitions.apply(payment, Payment::approve);
        log.info("Payment {} approved by company {}", paymentId, companyId);
        return approved;
    }

    public Payment dispute(UUID companyId, UUID paymentId, String reason) {
        return disputes.dispute(paymentId, companyId, reason);
    }
}
