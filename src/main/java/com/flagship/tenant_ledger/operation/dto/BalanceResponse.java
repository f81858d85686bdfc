package com.flagship.tenant_ledger.operation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class BalanceResponse {
    @JsonProperty("tenant_id")
    Long tenantId;

    /** Fold of CONFIRMED entries. */
    @JsonProperty("confirmed")
    BigDecimal confirmed;

    /** Confirmed minus funds reserved by pending withdrawals. */
    @JsonProperty("available")
    BigDecimal available;

    /** Incoming money not yet confirmed by the gateway. */
    @JsonProperty("pending_credits")
    BigDecimal pendingCredits;
}
