package com.flagship.tenant_ledger.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class GatewayPaymentRequest {
    String accountId;
    String correlationId;
    PaymentMethod method;
    BigDecimal amount;
    String description;
    PayerDetails payer;
    LocalDate dueDate;          // BOLETO only
    Integer expiresInSeconds;   // PIX only
}
