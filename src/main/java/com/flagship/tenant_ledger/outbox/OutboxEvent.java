package com.flagship.tenant_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An audit event waiting in the outbox for publication.
 *
 * Written in the same transaction as the ledger change (or report) it
 * describes, then shipped to Kafka by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // LedgerEntry, TransactionLog, WebhookInbox, ReconciliationReport
    UUID aggregateId;
    Long tenantId;             // null for events with no tenant, e.g. an unmatched webhook
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId, Long tenantId,
                                     String eventType, String payload) {
        return new OutboxEvent(
                UUID.randomUUID(),
                aggregateType,
                aggregateId,
                tenantId,
                eventType,
                payload,
                Instant.now(),
                null,
                0,
                null,
                null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * Kafka record key: the tenant when known, otherwise the aggregate.
     */
    public String partitionKey() {
        return tenantId != null ? tenantId.toString() : aggregateId.toString();
    }
}
