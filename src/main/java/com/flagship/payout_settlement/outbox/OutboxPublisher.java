package com.flagship.payout_settlement.outbox;

import com.flagship.payout_settlement.observability.CorrelationContext;
import com.flagship.payout_settlement.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and ships payment lifecycle events to Kafka.
 *
 * - The payment ID is the record key, so events for one payment stay ordered on one partition
 * - Each send is awaited before the row is marked published
 * - A failed send bumps retry_count; rows at max-retries stop being polled (dead letter)
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.payout-events:payout-events}")
    private String payoutEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Value("${outbox.retention-days:7}")
    private int retentionDays;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findPublishable(batchSize);
        } catch (Exception e) {
            log.error("Error polling the outbox", e);
            return;
        }
        if (!events.isEmpty()) {
            log.debug("Publishing {} outbox events", events.size());
        }
        events.forEach(this::publishEvent);
    }

    @Scheduled(cron = "${outbox.cleanup-cron:0 30 3 * * *}")
    public void purgePublishedEvents() {
        Instant cutoff = Instant.now().minus(Duration.ofDays(retentionDays));
        int deleted = outboxService.purgePublishedBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} published outbox events older than {}", deleted, cutoff);
        }
    }

    void publishEvent(OutboxEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(payoutEventsTopic, event.getAggregateId().toString(), event.getPayload());
        record.headers().add("event_type", event.getEventType().getBytes(StandardCharsets.UTF_8));
        if (event.getCorrelationId() != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        }
    }
}
