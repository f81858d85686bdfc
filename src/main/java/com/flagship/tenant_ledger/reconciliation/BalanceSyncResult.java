package com.flagship.tenant_ledger.reconciliation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of comparing a tenant's confirmed balance with the gateway's.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BalanceSyncResult {
    @JsonProperty("report_id")
    UUID reportId;
    @JsonProperty("tenant_id")
    Long tenantId;
    @JsonProperty("internal_balance")
    BigDecimal internalBalance;
    @JsonProperty("external_balance")
    BigDecimal externalBalance;
    @JsonProperty("difference")
    BigDecimal difference;
    @JsonProperty("reconciled")
    boolean reconciled;
    /** Only filled when the balances disagree. */
    @JsonProperty("discrepancies")
    List<Discrepancy> discrepancies;
    @JsonProperty("checked_at")
    Instant checkedAt;
}
