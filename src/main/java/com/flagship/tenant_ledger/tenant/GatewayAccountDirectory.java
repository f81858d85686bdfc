package com.flagship.tenant_ledger.tenant;

import com.flagship.tenant_ledger.exception.TenantAccountNotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * Resolves tenants to their gateway accounts.
 *
 * The tenant directory itself belongs to the onboarding flow; the ledger only reads from it.
 */
public interface GatewayAccountDirectory {

    Optional<GatewayAccount> findByTenantId(Long tenantId);

    List<GatewayAccount> findActiveAccounts();

    /**
     * @throws TenantAccountNotFoundException if the tenant has no active gateway account
     */
    default String resolveExternalAccountId(Long tenantId) {
        return findByTenantId(tenantId)
                .filter(GatewayAccount::isActive)
                .map(GatewayAccount::getExternalAccountId)
                .orElseThrow(() -> new TenantAccountNotFoundException(tenantId));
    }
}
