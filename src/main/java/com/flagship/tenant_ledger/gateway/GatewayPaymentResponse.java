package com.flagship.tenant_ledger.gateway;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class GatewayPaymentResponse {
    String externalId;
    GatewayTransactionStatus status;
    String qrCodeOrBarcode;
    String paymentUrl;
    Instant expiresAt;
    int httpStatus;
    String rawResponse;
}
