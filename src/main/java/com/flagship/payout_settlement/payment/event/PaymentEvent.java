package com.flagship.payout_settlement.payment.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for payment lifecycle events.
 *
 * All payment events share:
 * - Event ID for deduplication
 * - Payment ID (aggregate ID)
 * - Timestamp of when the event occurred
 */
public interface PaymentEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    UUID getPaymentId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
