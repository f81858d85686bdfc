package com.flagship.tenant_ledger.audit.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The gateway reported an outcome that conflicts with the entry's settled
 * state, e.g. success for an entry the ledger already reversed.
 */
@Value
public class ContradictoryOutcomeEvent implements AuditEvent {
    UUID eventId;
    Long tenantId;
    UUID entryId;
    String gatewayTransactionId;
    String ledgerStatus;
    String gatewayStatus;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ContradictoryOutcome";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
