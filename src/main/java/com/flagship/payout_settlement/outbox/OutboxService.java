package com.flagship.payout_settlement.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payout_settlement.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes payment lifecycle events to the outbox.
 *
 * "If the status change commits, the event is guaranteed to be written."
 * Events are not sent to Kafka here; {@link OutboxPublisher} does that.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    /**
     * Saves an event within the caller's transaction. MANDATORY propagation:
     * calling this outside a transaction is a programming error.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType,
            serializePayload(payload), CorrelationContext.currentCorrelationId());

        OutboxEvent saved = repository.save(OutboxEventEntity.fromDomain(event)).toDomain();
        log.debug("Saved outbox event: type={}, aggregateId={}", eventType, aggregateId);
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishable(int limit) {
        return repository.findPublishableForUpdate(limit, maxRetries).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Outbox event {} failed to publish (attempt {}): {}",
                eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForPayment(UUID paymentId) {
        return repository.findByAggregateIdOrderBySequenceNumberAsc(paymentId).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional
    public int purgePublishedBefore(Instant cutoff) {
        return repository.deletePublishedBefore(cutoff);
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
