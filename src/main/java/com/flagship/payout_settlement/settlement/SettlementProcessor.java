package com.flagship.payout_settlement.settlement;

import com.flagship.payout_settlement.method.PaymentMethod;
import com.flagship.payout_settlement.method.PaymentMethodRegistry;
import com.flagship.payout_settlement.method.PayoutMethodType;
import com.flagship.payout_settlement.method.SettlementMethod;
import com.flagship.payout_settlement.notification.EscalationDispatcher;
import com.flagship.payout_settlement.notification.EscalationType;
import com.flagship.payout_settlement.notification.RecipientRole;
import com.flagship.payout_settlement.observability.CorrelationContext;
import com.flagship.payout_settlement.observability.SettlementMetrics;
import com.flagship.payout_settlement.payment.FailureKind;
import com.flagship.payout_settlement.payment.Payment;
import com.flagship.payout_settlement.payment.PaymentFilter;
import com.flagship.payout_settlement.payment.PaymentRecordStore;
import com.flagship.payout_settlement.payment.PaymentStatus;
import com.flagship.payout_settlement.payment.PaymentTransitionService;
import com.flagship.payout_settlement.payment.exception.ConcurrencyConflictException;
import com.flagship.payout_settlement.payment.exception.InvalidTransitionException;
import com.flagship.payout_settlement.settings.PlatformSettingsStore;
import com.flagship.payout_settlement.settlement.rail.PaymentRail;
import com.flagship.payout_settlement.settlement.rail.RailRequest;
import com.flagship.payout_settlement.settlement.rail.RailResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Disburses approved payments through the payment rail.
 *
 * One settle call:
 * 1. COMPLETED returns ALREADY_COMPLETED without touching the rail; PENDING is approved first
 * 2. The creator's default payout method must be usable
 * 3. The net amount must reach the method's configured minimum
 * 4. The net amount must fit in the spendable funding balance, when the rail reports one
 * 5. The rail is called with idempotency key "settle-{paymentId}"
 * 6. The result is written with compare-and-set: COMPLETED, or FAILED with a classified reason
 *
 * This class is not transactional. The rail call happens
 * outside any database transaction and each status write commits on its
 * own, so a failure is persisted before it is reported.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementProcessor {

    private final PaymentTransitionService transitions;
    private final PaymentRecordStore store;
    private final PaymentMethodRegistry methods;
    private final MinimumAmountPolicy minimumAmounts;
    private final PlatformSettingsStore settings;
    private final PaymentRail rail;
    private final RailIdempotencyService idempotency;
    private final EscalationDispatcher escalations;
    private final SettlementMetrics metrics;

    /**
     * Settles one payment.
     *
     * @throws ConcurrencyConflictException if another writer changed the payment mid-settlement
     * @throws InvalidTransitionException if the payment is FAILED or REFUNDED
     */
    public SettlementOutcome settle(UUID paymentId) {
        long start = System.nanoTime();
        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId.toString());
        try {
            Payment payment = transitions.load(paymentId);

            if (payment.getStatus() == PaymentStatus.COMPLETED) {
                log.info("Payment already completed, skipping rail");
                metrics.recordSettlement(SettlementOutcome.Result.ALREADY_COMPLETED.name(), null);
                return SettlementOutcome.alreadyCompleted(payment);
            }
            if (!payment.getStatus().isSettleable()) {
                throw new InvalidTransitionException(paymentId, payment.getStatus(), PaymentStatus.COMPLETED,
                    String.format("Cannot settle payment in %s status. Only PENDING or PROCESSING payments can be settled.",
                        payment.getStatus()));
            }
            if (payment.getStatus() == PaymentStatus.PENDING) {
                payment = transitions.apply(payment, Payment::approve);
            }

            SettlementMethod settlementMethod = methods.findSettlementMethod(payment.getCreatorId());
            PayoutMethodType methodType = settlementMethod.getType().orElse(null);
            if (!settlementMethod.isUsable()) {
                return fail(payment, FailureKind.OTHER, settlementMethod.getUnavailableReason(), methodType);
            }
            PaymentMethod method = settlementMethod.getMethod();
            BigDecimal net = payment.getNetAmount();

            Optional<BigDecimal> minimum = minimumAmounts.minimumFor(methodType);
            if (minimum.isEmpty()) {
                return fail(payment, FailureKind.OTHER,
                    "No minimum payout amount configured for " + methodType, methodType);
            }
            if (net.compareTo(minimum.get()) < 0) {
                return fail(payment, FailureKind.BELOW_MINIMUM_AMOUNT,
                    String.format("Net amount $%s is below the $%s minimum for %s", net, minimum.get(), methodType),
                    methodType);
            }

            Optional<BigDecimal> spendable = spendableBalance();
            if (spendable.isPresent() && net.compareTo(spendable.get()) > 0) {
                return fail(payment, FailureKind.INSUFFICIENT_FUNDS,
                    String.format("Net amount $%s exceeds the spendable funding balance $%s", net, spendable.get()),
                    methodType);
            }

            String idempotencyKey = RailIdempotencyService.keyFor(paymentId);
            RailResult result = idempotency.findSettledTransaction(idempotencyKey)
                .map(RailResult::success)
                .orElseGet(() -> callRail(RailRequest.builder()
                    .paymentId(paymentId)
                    .amount(net)
                    .method(methodType)
                    .destination(method.getDestination())
                    .idempotencyKey(idempotencyKey)
                    .build()));

            if (!result.isSuccess()) {
                return fail(payment, failureKindFor(result.getStatus()), result.getMessage(), methodType);
            }

            idempotency.recordSuccess(idempotencyKey, result.getTransactionId());
            Payment completed = transitions.apply(payment, p -> p.complete(methodType, result.getTransactionId()));
            metrics.recordSettlement(SettlementOutcome.Result.COMPLETED.name(), null);
            log.info("Payment settled: net={}, method={}, railTx={}", net, methodType, result.getTransactionId());
            return SettlementOutcome.completed(completed);

        } finally {
            metrics.recordSettlementDuration(Duration.ofNanos(System.nanoTime() - start));
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    /**
     * Settles every PROCESSING payment matching the filter, one at a time.
     * A failure or exception on one item never stops the others.
     */
    public BulkSettlementResult settleAll(PaymentFilter filter) {
        PaymentFilter processing = filter.toBuilder().statuses(Set.of(PaymentStatus.PROCESSING)).build();
        List<Payment> candidates = store.findAll(processing);
        log.info("Bulk settlement started for {} payments", candidates.size());

        List<SettlementOutcome> outcomes = new ArrayList<>(candidates.size());
        for (Payment candidate : candidates) {
            outcomes.add(settleIsolated(candidate.getId()));
        }

        BulkSettlementResult result = BulkSettlementResult.of(outcomes);
        metrics.recordBulkSettlement(result.getSucceeded(), result.getFailed());
        log.info("Bulk settlement finished: total={}, succeeded={}, failed={}",
            result.getTotal(), result.getSucceeded(), result.getFailed());
        return result;
    }

    /**
     * Moves an operationally failed payment back to PROCESSING. Disputed payments are rejected.
     */
    public Payment retry(UUID paymentId) {
        Payment payment = transitions.load(paymentId);
        Payment retried = transitions.apply(payment, Payment::retry);
        log.info("Payment {} queued for retry after {} failure", paymentId,
            payment.getFailure() != null ? payment.getFailure().getKind() : "unknown");
        return retried;
    }

    /**
     * Refunds a completed payment to the company.
     */
    public Payment refund(UUID paymentId, String reason) {
        Payment payment = transitions.load(paymentId);
        if (payment.getStatus() != PaymentStatus.COMPLETED) {
            throw new InvalidTransitionException(paymentId, payment.getStatus(), PaymentStatus.REFUNDED,
                String.format("Cannot refund payment in %s status. Only COMPLETED payments can be refunded; "
                    + "disputed payments are refunded by resolving the dispute.", payment.getStatus()));
        }
        Payment refunded = transitions.apply(payment, p -> p.refund(reason));
        log.info("Payment {} refunded: {}", paymentId, reason);
        return refunded;
    }

    private SettlementOutcome settleIsolated(UUID paymentId) {
        try {
            return settle(paymentId);
        } catch (ConcurrencyConflictException e) {
            metrics.recordSettlement(SettlementOutcome.Result.CONFLICT.name(), null);
            return SettlementOutcome.conflict(paymentId, e.getMessage());
        } catch (InvalidTransitionException e) {
            Payment current = transitions.load(paymentId);
            log.warn("Payment {} left PROCESSING before settlement reached it, now {}{}", paymentId,
                current.getStatus(), current.isDisputed() ? " (disputed)" : "");
            metrics.recordSettlement(SettlementOutcome.Result.CONFLICT.name(), null);
            return SettlementOutcome.changed(current, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Settlement of payment {} failed unexpectedly", paymentId, e);
            return SettlementOutcome.error(paymentId, e.getMessage());
        }
    }

    private RailResult callRail(RailRequest request) {
        try {
            return rail.attempt(request);
        } catch (RuntimeException e) {
            log.error("Payment rail threw while settling {}: {}", request.getPaymentId(), e.getMessage());
            return RailResult.failure(RailResult.Status.OTHER, "Payment rail error: " + e.getMessage());
        }
    }

    private Optional<BigDecimal> spendableBalance() {
        return rail.availableBalance().map(balance -> {
            BigDecimal reserve = balance.multiply(settings.getReserveRate());
            return balance.subtract(reserve).subtract(settings.getMinimumOperatingBalance());
        });
    }

    private SettlementOutcome fail(Payment payment, FailureKind kind, String reason, PayoutMethodType method) {
        Payment failed = transitions.apply(payment, p -> p.fail(kind, reason, method));
        metrics.recordSettlement(SettlementOutcome.Result.FAILED.name(), kind);
        log.warn("Settlement failed: kind={}, reason={}", kind, reason);
        escalate(failed, kind, reason);
        return SettlementOutcome.failed(failed, kind, reason);
    }

    private void escalate(Payment payment, FailureKind kind, String reason) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("reason", reason);
        details.put("net_amount", payment.getNetAmount().toPlainString());
        details.put("creator_id", payment.getCreatorId().toString());
        if (payment.getPayoutMethod() != null) {
            details.put("payout_method", payment.getPayoutMethod().name());
        }

        RecipientRole recipient = kind == FailureKind.INSUFFICIENT_FUNDS ? RecipientRole.COMPANY : RecipientRole.ADMIN;
        UUID recipientId = recipient == RecipientRole.COMPANY ? payment.getCompanyId() : null;
        EscalationType type = switch (kind) {
            case INSUFFICIENT_FUNDS -> EscalationType.INSUFFICIENT_FUNDS;
            case BELOW_MINIMUM_AMOUNT -> EscalationType.BELOW_MINIMUM;
            case OTHER, DISPUTED -> EscalationType.SETTLEMENT_FAILED;
        };

        try {
            escalations.notify(recipient, recipientId, type, payment.getId(), details);
        } catch (RuntimeException e) {
            log.error("Escalation {} for payment {} could not be dispatched: {}", type, payment.getId(), e.getMessage());
        }
    }

    private static FailureKind failureKindFor(RailResult.Status status) {
        return switch (status) {
            case INSUFFICIENT_FUNDS -> FailureKind.INSUFFICIENT_FUNDS;
            case BELOW_MINIMUM_AMOUNT -> FailureKind.BELOW_MINIMUM_AMOUNT;
            case OTHER, SUCCESS -> FailureKind.OTHER;
        };
    }
}
