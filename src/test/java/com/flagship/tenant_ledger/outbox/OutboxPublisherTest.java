package com.flagship.tenant_ledger.outbox;

import com.flagship.tenant_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class OutboxPublisherTest {

    private static final String TOPIC = "ledger-audit";

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private OutboxMetrics outboxMetrics;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        outboxMetrics = mock(OutboxMetrics.class);
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "auditTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 10);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
    }

    private static OutboxEvent event(Long tenantId, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "LedgerEntry", UUID.randomUUID(), tenantId,
                "PendingEscalation", "{\"reason\":\"test\"}", Instant.now(), null, retryCount, null, 1L);
    }

    private static CompletableFuture<SendResult<String, String>> sent(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(TOPIC, event.partitionKey(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    @Test
    @DisplayName("Events are sent keyed by tenant and marked published")
    void publishesKeyedByTenant() {
        // Given
        OutboxEvent event = event(42L, 0);
        when(outboxService.findUnpublishedEvents(10, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, "42", event.getPayload())).thenReturn(sent(event));

        // When
        publisher.publishPendingEvents();

        // Then
        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("PendingEscalation");
    }

    @Test
    @DisplayName("Events without a tenant are keyed by aggregate")
    void keyedByAggregateWithoutTenant() {
        OutboxEvent event = event(null, 0);
        when(outboxService.findUnpublishedEvents(10, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload())).thenReturn(sent(event));

        publisher.publishPendingEvents();

        verify(outboxService).markPublished(event.getId());
    }

    @Test
    @DisplayName("A failed send records the error and keeps the event unpublished")
    void failedSend() {
        OutboxEvent event = event(42L, 1);
        when(outboxService.findUnpublishedEvents(10, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordEventPublishFailed("PendingEscalation");
    }

    @Test
    @DisplayName("The last allowed failure dead-letters the event")
    void lastFailureDeadLetters() {
        // Given: two earlier failures with a limit of three
        OutboxEvent event = event(42L, 2);
        when(outboxService.findUnpublishedEvents(10, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        // When
        publisher.publishPendingEvents();

        // Then
        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxMetrics).recordEventDeadLettered("PendingEscalation");
    }

    @Test
    @DisplayName("An earlier failure is not dead-lettered yet")
    void earlyFailureIsRetried() {
        OutboxEvent event = event(42L, 0);
        when(outboxService.findUnpublishedEvents(10, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }
}
