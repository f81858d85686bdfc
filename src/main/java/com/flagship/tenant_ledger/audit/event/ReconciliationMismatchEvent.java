package com.flagship.tenant_ledger.audit.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The ledger balance and the gateway balance disagree beyond tolerance.
 */
@Value
public class ReconciliationMismatchEvent implements AuditEvent {
    UUID eventId;
    Long tenantId;
    UUID reportId;
    BigDecimal internalBalance;
    BigDecimal externalBalance;
    BigDecimal difference;
    int discrepancyCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ReconciliationMismatch";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
