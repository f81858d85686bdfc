package com.flagship.tenant_ledger.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One transaction as the gateway reports it. Amount is signed like a ledger entry.
 */
@Value
@Builder
public class GatewayStatementItem {
    String externalId;
    String correlationId;
    BigDecimal amount;
    GatewayTransactionStatus status;
    Instant createdAt;
}
