package com.flagship.payout_settlement.payment;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Query criteria for payment listings and bulk settlement.
 * Null fields do not constrain the result.
 */
@Value
@Builder(toBuilder = true)
public class PaymentFilter {
    UUID creatorId;
    UUID companyId;
    UUID offerId;
    Set<PaymentStatus> statuses;
    String search;
    boolean disputedOnly;

    public static PaymentFilter all() {
        return PaymentFilter.builder().build();
    }

    public static PaymentFilter withStatus(PaymentStatus status) {
        return PaymentFilter.builder().statuses(Set.of(status)).build();
    }

    public boolean matches(Payment payment) {
        if (creatorId != null && !creatorId.equals(payment.getCreatorId())) {
            return false;
        }
        if (companyId != null && !companyId.equals(payment.getCompanyId())) {
            return false;
        }
        if (offerId != null && !offerId.equals(payment.getOfferId())) {
            return false;
        }
        if (statuses != null && !statuses.isEmpty() && !statuses.contains(payment.getStatus())) {
            return false;
        }
        if (disputedOnly && !payment.isDisputed()) {
            return false;
        }
        return matchesSearch(payment);
    }

    private boolean matchesSearch(Payment payment) {
        if (search == null || search.isBlank()) {
            return true;
        }
        String needle = search.trim().toLowerCase(Locale.ROOT);
        if (payment.getId().toString().startsWith(needle)) {
            return true;
        }
        String description = payment.getDescription();
        return description != null && description.toLowerCase(Locale.ROOT).contains(needle);
    }
}
