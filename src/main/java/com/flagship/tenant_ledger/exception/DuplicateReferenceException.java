package com.flagship.tenant_ledger.exception;

/**
 * An active entry already exists for the same tenant, business reference and entry type.
 * Callers treat this as success of the original request.
 */
public class DuplicateReferenceException extends LedgerException {

    private final Long tenantId;
    private final String referenceId;

    public DuplicateReferenceException(Long tenantId, String referenceId, String entryType) {
        super("DUPLICATE_REFERENCE", String.format(
                "Active %s entry already exists for tenant %d and reference %s",
                entryType, tenantId, referenceId));
        this.tenantId = tenantId;
        this.referenceId = referenceId;
    }

    public Long getTenantId() {
        return tenantId;
    }

    public String getReferenceId() {
        return referenceId;
    }
}
