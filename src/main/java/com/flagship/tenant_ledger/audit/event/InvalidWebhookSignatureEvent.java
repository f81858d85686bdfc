package com.flagship.tenant_ledger.audit.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class InvalidWebhookSignatureEvent implements AuditEvent {
    UUID eventId;
    UUID inboxId;
    String payloadHash;
    boolean signaturePresent;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvalidWebhookSignature";

    @Override
    public Long getTenantId() {
        return null;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
