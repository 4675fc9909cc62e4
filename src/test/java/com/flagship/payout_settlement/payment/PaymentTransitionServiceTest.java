package com.flagship.payout_settlement.payment;

import com.flagship.payout_settlement.method.PayoutMethodType;
import com.flagship.payout_settlement.observability.SettlementMetrics;
import com.flagship.payout_settlement.outbox.OutboxService;
import com.flagship.payout_settlement.payment.event.PaymentRecordedEvent;
import com.flagship.payout_settlement.payment.event.PaymentSettledEvent;
import com.flagship.payout_settlement.payment.event.PaymentStatusChangedEvent;
import com.flagship.payout_settlement.payment.exception.ConcurrencyConflictException;
import com.flagship.payout_settlement.payment.exception.InvalidTransitionException;
import com.flagship.payout_settlement.payment.exception.PaymentNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Status writes: compare-and-set against the status that was read, one
 * outbox event per successful write, no event on a lost write.
 */
class PaymentTransitionServiceTest {

    private InMemoryPaymentRecordStore store;
    private OutboxService outboxService;
    private SimpleMeterRegistry meterRegistry;
    private PaymentTransitionService transitions;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryPaymentRecordStore();
        outboxService = mock(OutboxService.class);
        meterRegistry = new SimpleMeterRegistry();
        transitions = new PaymentTransitionService(store, outboxService, new SettlementMetrics(meterRegistry));
    }

    @Test
    @DisplayName("Recording a payment stores it and writes PaymentRecorded")
    void recordWritesEvent() {
        Payment saved = transitions.record(PaymentFixtures.pending("100.00"));

        assertEquals(PaymentStatus.PENDING, store.findById(saved.getId()).orElseThrow().getStatus());
        verify(outboxService).saveEvent(eq(PaymentTransitionService.AGGREGATE_TYPE), eq(saved.getId()),
            eq(PaymentRecordedEvent.EVENT_TYPE), any());
        assertEquals(1.0, meterRegistry.counter("payout.recorded").count());
    }

    @Test
    @DisplayName("Only PENDING payments can be recorded")
    void recordRejectsNonPending() {
        assertThrows(IllegalArgumentException.class,
            () -> transitions.record(PaymentFixtures.processing("10.00")));
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Approve through the engine persists PROCESSING and writes PaymentApproved")
    void applyApprove() {
        Payment saved = transitions.record(PaymentFixtures.pending("100.00"));

        Payment approved = transitions.apply(saved, Payment::approve);

        assertEquals(PaymentStatus.PROCESSING, approved.getStatus());
        assertEquals(PaymentStatus.PROCESSING, transitions.load(saved.getId()).getStatus());
        verify(outboxService).saveEvent(eq(PaymentTransitionService.AGGREGATE_TYPE), eq(saved.getId()),
            eq(PaymentStatusChangedEvent.APPROVED), any());
    }

    @Test
    @DisplayName("Completion writes PaymentSettled")
    void applyComplete() {
        Payment saved = transitions.record(PaymentFixtures.pending("100.00"));
        Payment processing = transitions.apply(saved, Payment::approve);

        transitions.apply(processing, p -> p.complete(PayoutMethodType.PAYPAL, "tx_1"));

        verify(outboxService).saveEvent(any(), eq(saved.getId()), eq(PaymentSettledEvent.EVENT_TYPE), any());
    }

    @Test
    @DisplayName("A stale read loses the compare-and-set and reports the status found")
    void staleReadConflicts() {
        printTestHeader("Stale Read Conflict");
        Payment saved = transitions.record(PaymentFixtures.pending("100.00"));
        Payment staleCopy = transitions.load(saved.getId());

        transitions.apply(saved, p -> p.dispute("Late delivery"));

        ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
            () -> transitions.apply(staleCopy, Payment::approve));
        printOutput("Conflict", e.getMessage());

        assertEquals(PaymentStatus.PENDING, e.getExpectedStatus());
        assertEquals(PaymentStatus.FAILED, e.getActualStatus());
        assertTrue(transitions.load(saved.getId()).isDisputed());
        verify(outboxService, never()).saveEvent(any(), any(), eq(PaymentStatusChangedEvent.APPROVED), any());
        assertEquals(1.0, meterRegistry.counter("payout.cas.conflicts").count());
        printSuccess("Loser wrote nothing");
    }

    @Test
    @DisplayName("An illegal edge is rejected before the store is touched")
    void illegalEdgeRejected() {
        Payment saved = transitions.record(PaymentFixtures.pending("100.00"));

        assertThrows(InvalidTransitionException.class,
            () -> transitions.apply(saved, p -> p.complete(PayoutMethodType.WIRE, "tx")));
        assertEquals(PaymentStatus.PENDING, transitions.load(saved.getId()).getStatus());
        verify(outboxService, times(1)).saveEvent(any(), any(), anyString(), any());
    }

    @Test
    @DisplayName("Loading an unknown payment throws PaymentNotFoundException")
    void loadUnknown() {
        UUID id = UUID.randomUUID();
        PaymentNotFoundException e = assertThrows(PaymentNotFoundException.class, () -> transitions.load(id));
        assertEquals(id, e.getPaymentId());
    }

    @Test
    @DisplayName("Concurrent approvals of one payment: exactly one wins")
    void concurrentApprovals() throws Exception {
        printTestHeader("Concurrent Approvals");
        Payment saved = transitions.record(PaymentFixtures.pending("100.00"));

        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    transitions.apply(saved, Payment::approve);
                    successes.incrementAndGet();
                } catch (ConcurrencyConflictException e) {
                    conflicts.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Successes", successes.get());
        printOutput("Conflicts", conflicts.get());
        assertEquals(1, successes.get());
        assertEquals(threads - 1, conflicts.get());
        assertEquals(PaymentStatus.PROCESSING, transitions.load(saved.getId()).getStatus());
        printSuccess("Exactly one status write landed");
    }
}
