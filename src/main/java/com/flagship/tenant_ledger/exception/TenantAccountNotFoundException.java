package com.flagship.tenant_ledger.exception;

public class TenantAccountNotFoundException extends LedgerException {

    public TenantAccountNotFoundException(Long tenantId) {
        super("TENANT_ACCOUNT_NOT_FOUND", "No active gateway account for tenant " + tenantId);
    }
}
