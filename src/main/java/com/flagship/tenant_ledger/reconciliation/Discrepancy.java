package com.flagship.tenant_ledger.reconciliation;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Discrepancy {
    DiscrepancyType type;
    UUID entryId;
    String externalTransactionId;
    BigDecimal ledgerAmount;
    BigDecimal gatewayAmount;
    String detail;
}
