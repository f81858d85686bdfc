package com.flagship.tenant_ledger.operation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.ledger.LedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LedgerEntryResponse {
    @JsonProperty("id")
    UUID id;
    @JsonProperty("type")
    String type;
    @JsonProperty("amount")
    BigDecimal amount;
    @JsonProperty("status")
    String status;
    @JsonProperty("reference_id")
    String referenceId;
    @JsonProperty("external_transaction_id")
    String externalTransactionId;
    @JsonProperty("reversal_of")
    UUID reversalOf;
    @JsonProperty("status_reason")
    String statusReason;
    @JsonProperty("description")
    String description;
    @JsonProperty("created_at")
    Instant createdAt;
    @JsonProperty("confirmed_at")
    Instant confirmedAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return new LedgerEntryResponse(
                entry.getId(),
                entry.getType().name(),
                entry.getAmount(),
                entry.getStatus().name(),
                entry.getReferenceId(),
                entry.getExternalTransactionId(),
                entry.getReversalOf(),
                entry.getStatusReason(),
                entry.getDescription(),
                entry.getCreatedAt(),
                entry.getConfirmedAt()
        );
    }
}
