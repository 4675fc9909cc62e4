package com.flagship.payout_settlement.settlement;

import com.flagship.payout_settlement.settlement.rail.PaymentRail;
import com.flagship.payout_settlement.settlement.rail.RailRequest;
import com.flagship.payout_settlement.settlement.rail.RailResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Rail double: succeeds unless a result was scripted for the payment, and
 * records every request it receives.
 */
class ScriptedPaymentRail implements PaymentRail {

    private final Map<UUID, RailResult> scripted = new ConcurrentHashMap<>();
    private final List<RailRequest> requests = new CopyOnWriteArrayList<>();
    private volatile BigDecimal balance;
    private volatile CountDownLatch gate;

    void script(UUID paymentId, RailResult result) {
        scripted.put(paymentId, result);
    }

    void reportBalance(BigDecimal balance) {
        this.balance = balance;
    }

    /**
     * Holds each attempt until {@code parties} attempts are in flight.
     */
    void holdUntil(int parties) {
        this.gate = new CountDownLatch(parties);
    }

    List<RailRequest> requests() {
        return requests;
    }

    long attemptsFor(UUID paymentId) {
        return requests.stream().filter(r -> r.getPaymentId().equals(paymentId)).count();
    }

    @Override
    public RailResult attempt(RailRequest request) {
        requests.add(request);
        CountDownLatch currentGate = gate;
        if (currentGate != null) {
            currentGate.countDown();
            try {
                if (!currentGate.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("Rail gate timed out");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        return scripted.getOrDefault(request.getPaymentId(),
            RailResult.success("tx_" + request.getPaymentId().toString().substring(0, 8)));
    }

    @Override
    public Optional<BigDecimal> availableBalance() {
        return Optional.ofNullable(balance);
    }
}
