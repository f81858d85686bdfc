package com.flagship.tenant_ledger.audit.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A pending entry, or a gateway call with unknown outcome, that the resolver
 * could not settle automatically.
 */
@Value
@Builder
public class PendingEscalationEvent implements AuditEvent {
    UUID eventId;
    Long tenantId;
    UUID entryId;               // null when no entry was ever written
    String correlationId;
    String referenceId;
    String externalTransactionId;
    BigDecimal amount;
    String gatewayStatus;
    long ageSeconds;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PendingEscalation";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
