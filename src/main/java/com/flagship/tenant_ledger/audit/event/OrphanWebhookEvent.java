package com.flagship.tenant_ledger.audit.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A correctly signed webhook that matches no transaction the ledger knows about.
 */
@Value
public class OrphanWebhookEvent implements AuditEvent {
    UUID eventId;
    UUID inboxId;
    String gatewayTransactionId;
    String correlationId;
    String gatewayStatus;
    BigDecimal amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrphanWebhook";

    @Override
    public Long getTenantId() {
        return null;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
