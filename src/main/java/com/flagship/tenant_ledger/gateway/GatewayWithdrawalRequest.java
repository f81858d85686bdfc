package com.flagship.tenant_ledger.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class GatewayWithdrawalRequest {
    String accountId;
    String correlationId;
    BigDecimal amount;
    BankAccountDetails destination;
    String description;
}
