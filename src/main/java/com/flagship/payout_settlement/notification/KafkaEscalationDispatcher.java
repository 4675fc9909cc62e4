package com.flagship.payout_settlement.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payout_settlement.observability.CorrelationContext;
import com.flagship.payout_settlement.observability.SettlementMetrics;
import com.flagship.payout_settlement.settings.PlatformSettingsStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Publishes escalations to Kafka for the notification service to deliver.
 *
 * The send is not awaited. Failures, synchronous or asynchronous, are
 * logged and counted; nothing propagates to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KafkaEscalationDispatcher implements EscalationDispatcher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final PlatformSettingsStore settings;
    private final SettlementMetrics metrics;

    @Value("${kafka.topic.escalations:payout-escalations}")
    private String escalationsTopic;

    @Override
    public void notify(RecipientRole recipientRole, UUID recipientId, EscalationType type,
                       UUID paymentId, Map<String, String> details) {
        try {
            Map<String, String> enriched = new LinkedHashMap<>(details);
            if (recipientRole == RecipientRole.ADMIN) {
                settings.getEscalationEmail().ifPresent(email -> enriched.put("escalation_email", email));
            }

            Escalation escalation = new Escalation(UUID.randomUUID(), recipientRole, recipientId, type,
                paymentId, enriched, Instant.now());
            ProducerRecord<String, String> record = new ProducerRecord<>(
                escalationsTopic, paymentId.toString(), objectMapper.writeValueAsString(escalation));
            String correlationId = CorrelationContext.currentCorrelationId();
            if (correlationId != null) {
                record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                    correlationId.getBytes(StandardCharsets.UTF_8));
            }

            kafkaTemplate.send(record).whenComplete((result, error) -> {
                if (error != null) {
                    log.error("Escalation delivery failed: type={}, paymentId={}, error={}",
                        type, paymentId, error.getMessage());
                    metrics.recordEscalation(type.name(), false);
                } else {
                    metrics.recordEscalation(type.name(), true);
                }
            });
            log.info("Escalation dispatched: type={}, recipient={}:{}, paymentId={}",
                type, recipientRole, recipientId, paymentId);
        } catch (Exception e) {
            log.error("Escalation could not be sent: type={}, paymentId={}, error={}",
                type, paymentId, e.getMessage());
            metrics.recordEscalation(type.name(), false);
        }
    }
}
