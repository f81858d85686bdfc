package com.flagship.tenant_ledger.audit.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact raised for operators rather than tenants: something the ledger will not
 * correct on its own.
 */
public interface AuditEvent {

    UUID getEventId();

    /**
     * Null when the event could not be attributed to a tenant.
     */
    Long getTenantId();

    Instant getOccurredAt();

    String getEventType();
}
