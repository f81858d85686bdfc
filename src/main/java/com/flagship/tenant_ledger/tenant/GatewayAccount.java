package com.flagship.tenant_ledger.tenant;

import lombok.Value;

import java.time.Instant;

/**
 * A tenant's account at the settlement gateway. Created at onboarding, read-only here.
 */
@Value
public class GatewayAccount {
    Long tenantId;
    String externalAccountId;
    GatewayAccountStatus status;
    Instant createdAt;

    public boolean isActive() {
        return status == GatewayAccountStatus.ACTIVE;
    }
}
