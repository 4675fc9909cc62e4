package com.flagship.payout_settlement.creator;

import com.flagship.payout_settlement.earnings.AmountBasis;
import com.flagship.payout_settlement.earnings.EarningsAggregator;
import com.flagship.payout_settlement.earnings.EarningsSummary;
import com.flagship.payout_settlement.method.PaymentMethod;
import com.flagship.payout_settlement.method.PaymentMethodRegistry;
import com.flagship.payout_settlement.method.dto.RegisterPaymentMethodRequest;
import com.flagship.payout_settlement.payment.Payment;
import com.flagship.payout_settlement.payment.PaymentFilter;
import com.flagship.payout_settlement.payment.PaymentRecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * What a creator can do: read their own payouts and earnings, and manage
 * where payouts are sent. Creators never change payment status.
 */
@Service
@RequiredArgsConstructor
public class CreatorPayoutService {

    private final PaymentRecordStore store;
    private final EarningsAggregator earnings;
    private final PaymentMethodRegistry methods;

    public List<Payment> listPayments(UUID creatorId, PaymentFilter filter) {
        return store.findForCreator(creatorId, filter);
    }

    /**
     * Creators see what they actually receive, so the summary is on net amounts.
     */
    public EarningsSummary getEarningsSummary(UUID creatorId) {
        return earnings.summarize(store.findForCreator(creatorId, PaymentFilter.all()), AmountBasis.NET);
    }

    public PaymentMethod registerPaymentMethod(UUID creatorId, RegisterPaymentMethodRequest request) {
        return methods.register(creatorId, request);
    }

    public List<PaymentMethod> listPaymentMethods(UUID creatorId) {
        return methods.list(creatorId);
    }

    public PaymentMethod setDefaultPaymentMethod(UUID creatorId, UUID methodId) {
        return methods.setDefault(creatorId, methodId);
    }

    public void deletePaymentMethod(UUID creatorId, UUID methodId) {
        methods.delete(creatorId, methodId);
    }

    public PaymentMethod attachExternalAccount(UUID creatorId, UUID methodId, String externalAccountId) {
        return methods.attachExternalAccount(creatorId, methodId, externalAccountId);
    }
}
