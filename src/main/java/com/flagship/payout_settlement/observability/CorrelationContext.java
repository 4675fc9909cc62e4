package com.flagship.payout_settlement.observability;

import java.util.UUID;

/**
 * Thread-local correlation ID.
 *
 * The ID is read from (or generated for) each HTTP request, put in the MDC,
 * stored on outbox rows, and sent as a Kafka header with lifecycle events
 * and escalations. Scheduled jobs start their own ID per run.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String PAYMENT_ID_MDC_KEY = "paymentId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current correlation ID, generating and binding one if none is set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /**
     * Current correlation ID, or null outside a correlated unit of work.
     */
    public static String currentCorrelationId() {
        return correlationId.get();
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readable logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
