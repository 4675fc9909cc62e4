package com.flagship.payout_settlement.outbox;

import com.flagship.payout_settlement.observability.CorrelationContext;
import com.flagship.payout_settlement.observability.OutboxMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Outbox publisher against a mocked Kafka template.
 *
 * These tests verify:
 * - Events are keyed by payment ID and carry type and correlation headers
 * - A row is marked published only after the send is acknowledged
 * - Failed sends are recorded for retry and do not stop the batch
 */
class OutboxPublisherTest {

    private static final String TOPIC = "payout-events";

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private SimpleMeterRegistry meterRegistry;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        meterRegistry = new SimpleMeterRegistry();
        OutboxMetrics outboxMetrics = new OutboxMetrics(mock(OutboxEventRepository.class), meterRegistry);

        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "payoutEventsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    private static OutboxEvent event(String type, String correlationId) {
        return OutboxEvent.create("Payment", UUID.randomUUID(), type, "{\"event_type\":\"" + type + "\"}", correlationId);
    }

    private static CompletableFuture<SendResult<String, String>> acked(ProducerRecord<String, String> record) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 1), 42L, 0, 0L, 36, 64);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("Published events are keyed by payment ID and marked published")
    @SuppressWarnings("unchecked")
    void publishesAndMarks() {
        OutboxEvent event = event("PaymentSettled", "abc12345");
        when(outboxService.findPublishable(100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class)))
            .thenAnswer(invocation -> acked(invocation.getArgument(0)));

        publisher.publishPendingEvents();

        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        ProducerRecord<String, String> record = captor.getValue();
        assertEquals(TOPIC, record.topic());
        assertEquals(event.getAggregateId().toString(), record.key());
        assertEquals(event.getPayload(), record.value());
        assertEquals("PaymentSettled",
            new String(record.headers().lastHeader("event_type").value(), StandardCharsets.UTF_8));
        assertEquals("abc12345", new String(
            record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER).value(), StandardCharsets.UTF_8));

        verify(outboxService).markPublished(event.getId());
        assertEquals(1.0, meterRegistry.counter("outbox.events.published",
            "event_type", "PaymentSettled", "status", "success").count());
    }

    @Test
    @DisplayName("A failed send is recorded and the rest of the batch still goes out")
    @SuppressWarnings("unchecked")
    void failureDoesNotStopBatch() {
        OutboxEvent failing = event("PaymentFailed", null);
        OutboxEvent ok = event("PaymentApproved", null);
        when(outboxService.findPublishable(100)).thenReturn(List.of(failing, ok));
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenAnswer(invocation -> {
            ProducerRecord<String, String> record = invocation.getArgument(0);
            if (record.key().equals(failing.getAggregateId().toString())) {
                return CompletableFuture.failedFuture(new IllegalStateException("broker unavailable"));
            }
            return acked(record);
        });

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(failing.getId()), anyString());
        verify(outboxService, never()).markPublished(failing.getId());
        verify(outboxService).markPublished(ok.getId());
        assertEquals(1.0, meterRegistry.counter("outbox.events.published",
            "event_type", "PaymentFailed", "status", "failure").count());
    }

    @Test
    @DisplayName("Events without a correlation ID carry no correlation header")
    @SuppressWarnings("unchecked")
    void noCorrelationHeader() {
        OutboxEvent event = event("PaymentRecorded", null);
        when(kafkaTemplate.send(any(ProducerRecord.class)))
            .thenAnswer(invocation -> acked(invocation.getArgument(0)));

        publisher.publishEvent(event);

        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        assertNull(captor.getValue().headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER));
    }

    @Test
    @DisplayName("An outbox polling error skips the cycle without sending")
    @SuppressWarnings("unchecked")
    void pollingError() {
        when(outboxService.findPublishable(anyInt())).thenThrow(new IllegalStateException("database down"));

        publisher.publishPendingEvents();

        verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
    }
}
