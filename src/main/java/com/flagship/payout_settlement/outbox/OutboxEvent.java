package com.flagship.payout_settlement.outbox;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A payment lifecycle event waiting in the outbox.
 *
 * Written in the same transaction as the status change it describes and
 * shipped to Kafka later by {@link OutboxPublisher}.
 */
@Value
@Builder(toBuilder = true)
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    String correlationId;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    /**
     * Creates a new unpublished outbox event. The sequence number is assigned by the database.
     */
    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                                     String payload, String correlationId) {
        return OutboxEvent.builder()
            .id(UUID.randomUUID())
            .aggregateType(aggregateType)
            .aggregateId(aggregateId)
            .eventType(eventType)
            .payload(payload)
            .correlationId(correlationId)
            .createdAt(Instant.now())
            .build();
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLetter(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
