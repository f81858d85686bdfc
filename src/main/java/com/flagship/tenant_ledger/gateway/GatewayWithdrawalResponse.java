package com.flagship.tenant_ledger.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class GatewayWithdrawalResponse {
    String externalId;
    GatewayTransactionStatus status;
    BigDecimal fee;
    int httpStatus;
    String rawResponse;
}
