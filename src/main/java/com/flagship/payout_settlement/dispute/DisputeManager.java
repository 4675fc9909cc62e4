package com.flagship.payout_settlement.dispute;

import com.flagship.payout_settlement.notification.EscalationDispatcher;
import com.flagship.payout_settlement.notification.EscalationType;
import com.flagship.payout_settlement.notification.RecipientRole;
import com.flagship.payout_settlement.payment.Payment;
import com.flagship.payout_settlement.payment.PaymentTransitionService;
import com.flagship.payout_settlement.payment.exception.InvalidTransitionException;
import com.flagship.payout_settlement.payment.exception.UnauthorizedException;
import com.flagship.payout_settlement.payment.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Company disputes and their admin resolution.
 *
 * A dispute moves the payment to FAILED tagged {@code DISPUTED}. From there only
 * an admin can move it on: REFUND to REFUNDED, RELEASE back to PROCESSING.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DisputeManager {

    private final PaymentTransitionService transitions;
    private final EscalationDispatcher escalations;

    /**
     * Disputes a pending or processing payment on behalf of the owning company.
     *
     * Checks run in order: reason, existence, ownership, status.
     *
     * @throws ValidationException if the reason is blank
     * @throws com.flagship.payout_settlement.payment.exception.PaymentNotFoundException if the payment does not exist
     * @throws UnauthorizedException if the company does not own the payment
     * @throws InvalidTransitionException if the payment is past PROCESSING
     */
    public Payment dispute(UUID paymentId, UUID actorCompanyId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Dispute reason is required");
        }
        Payment payment = transitions.load(paymentId);
        if (!payment.getCompanyId().equals(actorCompanyId)) {
            throw UnauthorizedException.notPaymentOwner(paymentId, actorCompanyId);
        }

        Payment disputed = transitions.apply(payment, p -> p.dispute(reason));
        log.info("Payment {} disputed by company {}: {}", paymentId, actorCompanyId, reason.trim());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("reason", reason.trim());
        details.put("company_id", actorCompanyId.toString());
        details.put("net_amount", disputed.getNetAmount().toPlainString());
        try {
            escalations.notify(RecipientRole.CREATOR, disputed.getCreatorId(), EscalationType.DISPUTED,
                paymentId, details);
        } catch (RuntimeException e) {
            log.error("Dispute notification for payment {} could not be dispatched: {}", paymentId, e.getMessage());
        }
        return disputed;
    }

    /**
     * Admin resolution of a disputed payment.
     *
     * @throws InvalidTransitionException if the payment is not disputed
     */
    public Payment resolveDispute(UUID paymentId, DisputeResolution resolution, String notes) {
        if (resolution == null) {
            throw new ValidationException("Resolution is required");
        }
        Payment payment = transitions.load(paymentId);
        if (!payment.isDisputed()) {
            throw new InvalidTransitionException(paymentId, payment.getStatus(), payment.getStatus(),
                "Payment " + paymentId + " is not disputed");
        }

        Payment resolved = switch (resolution) {
            case REFUND -> transitions.apply(payment, p -> p.refund(notes));
            case RELEASE -> transitions.apply(payment, p -> p.releaseDispute(notes));
        };
        log.info("Dispute on payment {} resolved: {} -> {}", paymentId, resolution, resolved.getStatus());
        return resolved;
    }
}
