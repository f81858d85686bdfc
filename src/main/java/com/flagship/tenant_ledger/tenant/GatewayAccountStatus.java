package com.flagship.tenant_ledger.tenant;

public enum GatewayAccountStatus {
    ACTIVE,
    PENDING,
    SUSPENDED
}
