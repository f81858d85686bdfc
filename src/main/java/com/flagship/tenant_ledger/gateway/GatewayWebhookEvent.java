package com.flagship.tenant_ledger.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Provider-neutral view of a webhook notification.
 */
@Value
@Builder
public class GatewayWebhookEvent {
    String gatewayTransactionId;
    String correlationId;
    GatewayTransactionStatus status;
    BigDecimal amount;
    BigDecimal fee;
    Instant occurredAt;
}
