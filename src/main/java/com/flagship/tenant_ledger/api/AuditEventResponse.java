package com.flagship.tenant_ledger.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.flagship.tenant_ledger.outbox.OutboxEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditEventResponse {
    @JsonProperty("id")
    UUID id;
    @JsonProperty("event_type")
    String eventType;
    @JsonProperty("aggregate_type")
    String aggregateType;
    @JsonProperty("aggregate_id")
    UUID aggregateId;
    @JsonRawValue
    @JsonProperty("payload")
    String payload;
    @JsonProperty("created_at")
    Instant createdAt;
    @JsonProperty("published_at")
    Instant publishedAt;

    public static AuditEventResponse from(OutboxEvent event) {
        return new AuditEventResponse(
                event.getId(),
                event.getEventType(),
                event.getAggregateType(),
                event.getAggregateId(),
                event.getPayload(),
                event.getCreatedAt(),
                event.getPublishedAt()
        );
    }
}
