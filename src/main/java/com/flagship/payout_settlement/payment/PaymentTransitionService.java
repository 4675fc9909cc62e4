package com.flagship.payout_settlement.payment;

import com.flagship.payout_settlement.observability.CorrelationContext;
import com.flagship.payout_settlement.observability.SettlementMetrics;
import com.flagship.payout_settlement.outbox.OutboxService;
import com.flagship.payout_settlement.payment.event.PaymentEvent;
import com.flagship.payout_settlement.payment.event.PaymentFailedEvent;
import com.flagship.payout_settlement.payment.event.PaymentRecordedEvent;
import com.flagship.payout_settlement.payment.event.PaymentSettledEvent;
import com.flagship.payout_settlement.payment.event.PaymentStatusChangedEvent;
import com.flagship.payout_settlement.payment.exception.ConcurrencyConflictException;
import com.flagship.payout_settlement.payment.exception.PaymentNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Single write path for payment records.
 *
 * Every status change goes through {@link #apply}: the domain method computes
 * the next state (rejecting illegal edges), then the store's compare-and-set
 * writes it only if the row still holds the status that was read. The
 * lifecycle event is written to the outbox in the same transaction.
 *
 * A lost compare-and-set raises {@link ConcurrencyConflictException}; this
 * service never retries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentTransitionService {

    static final String AGGREGATE_TYPE = "Payment";

    private final PaymentRecordStore store;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;

    @Transactional(readOnly = true)
    public Payment load(UUID paymentId) {
        return store.findById(paymentId)
            .orElseThrow(() -> new PaymentNotFoundException(paymentId));
    }

    /**
     * Persists a freshly created PENDING payment.
     */
    @Transactional
    public Payment record(Payment payment) {
        if (payment.getStatus() != PaymentStatus.PENDING) {
            throw new IllegalArgumentException("New payments must be PENDING, got " + payment.getStatus());
        }
        Payment saved = store.create(payment);
        writeEvent(saved.getId(), PaymentRecordedEvent.fromPayment(saved));
        metrics.recordPaymentRecorded(saved.isRequiresReview());
        return saved;
    }

    /**
     * Applies a status change computed from {@code current}.
     *
     * @param current the payment as read by the caller
     * @param change domain transition, e.g. {@code Payment::approve}
     * @return the payment as written
     * @throws ConcurrencyConflictException if the stored status is no longer {@code current.getStatus()}
     */
    @Transactional
    public Payment apply(Payment current, UnaryOperator<Payment> change) {
        UUID paymentId = current.getId();
        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId.toString());
        try {
            Payment updated = change.apply(current);
            PaymentStatus expected = current.getStatus();

            if (!store.compareAndSet(paymentId, expected, updated)) {
                metrics.recordConflict();
                PaymentStatus actual = store.findById(paymentId).map(Payment::getStatus).orElse(null);
                log.warn("Status write lost: expected={}, actual={}, target={}", expected, actual, updated.getStatus());
                throw new ConcurrencyConflictException(paymentId, expected, actual);
            }

            writeEvent(paymentId, eventFor(current, updated));
            metrics.recordTransition(expected, updated.getStatus());
            log.info("Payment status changed: {} -> {}", expected, updated.getStatus());
            return updated;
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    private void writeEvent(UUID paymentId, PaymentEvent event) {
        outboxService.saveEvent(AGGREGATE_TYPE, paymentId, event.getEventType(), event);
    }

    private static PaymentEvent eventFor(Payment before, Payment after) {
        String previous = before.getStatus().name();
        return switch (after.getStatus()) {
            case COMPLETED -> PaymentSettledEvent.fromPayment(after);
            case FAILED -> PaymentFailedEvent.fromPayment(after, previous);
            case REFUNDED -> PaymentStatusChangedEvent.of(PaymentStatusChangedEvent.REFUNDED, after, previous);
            case PROCESSING -> PaymentStatusChangedEvent.of(processingEventType(before), after, previous);
            case PENDING -> throw new IllegalStateException("No transition leads back to PENDING");
        };
    }

    private static String processingEventType(Payment before) {
        if (before.getStatus() == PaymentStatus.PENDING) {
            return PaymentStatusChangedEvent.APPROVED;
        }
        return before.isDisputed() ? PaymentStatusChangedEvent.DISPUTE_RELEASED : PaymentStatusChangedEvent.RETRIED;
    }
}
