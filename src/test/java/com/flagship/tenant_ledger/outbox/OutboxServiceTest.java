package com.flagship.tenant_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tenant_ledger.PostgresTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class OutboxServiceTest extends PostgresTestSupport {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private OutboxEvent save(Long tenantId, UUID aggregateId, String eventType) {
        return transactionTemplate.execute(status -> outboxService.saveEvent(
                "LedgerEntry", aggregateId, tenantId, eventType,
                Map.of("entryId", aggregateId.toString(), "reason", "test")));
    }

    @Test
    @DisplayName("Saved event carries its aggregate, tenant and JSON payload")
    void saveEvent() throws Exception {
        // Given
        long tenantId = newTenantId();
        UUID aggregateId = UUID.randomUUID();

        // When
        OutboxEvent event = save(tenantId, aggregateId, "PendingEscalation");

        // Then
        assertNotNull(event.getId());
        assertEquals("LedgerEntry", event.getAggregateType());
        assertEquals(aggregateId, event.getAggregateId());
        assertEquals(tenantId, event.getTenantId());
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());
        assertEquals(String.valueOf(tenantId), event.partitionKey());

        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertEquals(aggregateId.toString(), payload.get("entryId").asText());
    }

    @Test
    @DisplayName("saveEvent refuses to run outside a transaction")
    void saveEventRequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class, () -> outboxService.saveEvent(
                "LedgerEntry", UUID.randomUUID(), newTenantId(), "PendingEscalation", Map.of()));
    }

    @Test
    @DisplayName("An event rolled back with its transaction is never stored")
    void rolledBackEventIsNotStored() {
        long tenantId = newTenantId();

        transactionTemplate.executeWithoutResult(status -> {
            outboxService.saveEvent("LedgerEntry", UUID.randomUUID(), tenantId, "PendingEscalation", Map.of());
            status.setRollbackOnly();
        });

        assertTrue(outboxService.getEventsForTenant(tenantId, "PendingEscalation").isEmpty());
    }

    @Test
    @DisplayName("Published events leave the backlog")
    void markPublished() {
        OutboxEvent event = save(newTenantId(), UUID.randomUUID(), "OrphanWebhook");
        long backlog = outboxService.countUnpublished();

        outboxService.markPublished(event.getId());

        OutboxEventEntity entity = outboxEventRepository.findById(event.getId()).orElseThrow();
        assertNotNull(entity.getPublishedAt());
        assertEquals(backlog - 1, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Each failed publish increments the retry count and keeps the last error")
    void markFailed() {
        OutboxEvent event = save(newTenantId(), UUID.randomUUID(), "ReconciliationMismatch");

        outboxService.markFailed(event.getId(), "Connection timeout");
        outboxService.markFailed(event.getId(), "Broker not available");

        OutboxEventEntity entity = outboxEventRepository.findById(event.getId()).orElseThrow();
        assertEquals(2, entity.getRetryCount());
        assertEquals("Broker not available", entity.getLastError());
        assertNull(entity.getPublishedAt());
    }

    @Test
    @DisplayName("Events that used up their retries are left out of the publishing batch")
    void exhaustedEventsLeaveTheBatch() {
        // Given
        OutboxEvent exhausted = save(newTenantId(), UUID.randomUUID(), "ReconciliationMismatch");
        OutboxEvent retrying = save(newTenantId(), UUID.randomUUID(), "ReconciliationMismatch");
        for (int i = 0; i < 3; i++) {
            outboxService.markFailed(exhausted.getId(), "Broker not available");
        }
        outboxService.markFailed(retrying.getId(), "Broker not available");

        // When
        List<UUID> batch = outboxService.findUnpublishedEvents(10_000, 3).stream()
                .map(OutboxEvent::getId)
                .toList();

        // Then
        assertFalse(batch.contains(exhausted.getId()));
        assertTrue(batch.contains(retrying.getId()));
    }

    @Test
    @DisplayName("Events are listed per tenant and per aggregate in write order")
    void queriesKeepOrder() {
        long tenantId = newTenantId();
        UUID aggregateId = UUID.randomUUID();

        OutboxEvent first = save(tenantId, aggregateId, "PendingEscalation");
        OutboxEvent second = save(tenantId, aggregateId, "PendingEscalation");
        save(tenantId, UUID.randomUUID(), "ContradictoryOutcome");

        List<OutboxEvent> forTenant = outboxService.getEventsForTenant(tenantId, "PendingEscalation");
        assertEquals(List.of(first.getId(), second.getId()),
                forTenant.stream().map(OutboxEvent::getId).toList());

        List<OutboxEvent> forAggregate = outboxService.getEventsForAggregate("LedgerEntry", aggregateId);
        assertEquals(2, forAggregate.size());
        assertTrue(forAggregate.get(0).getSequenceNumber() < forAggregate.get(1).getSequenceNumber());
    }
}
