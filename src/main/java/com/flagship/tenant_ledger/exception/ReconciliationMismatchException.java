package com.flagship.tenant_ledger.exception;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Internal and gateway balances diverged beyond tolerance. Reported, never auto-healed.
 */
public class ReconciliationMismatchException extends LedgerException {

    private final Long tenantId;
    private final UUID reportId;

    public ReconciliationMismatchException(Long tenantId, UUID reportId,
                                           BigDecimal internal, BigDecimal external) {
        super("RECONCILIATION_MISMATCH", String.format(
                "Balance mismatch for tenant %d: internal=%s, external=%s (report %s)",
                tenantId, internal, external, reportId));
        this.tenantId = tenantId;
        this.reportId = reportId;
    }

    public Long getTenantId() {
        return tenantId;
    }

    public UUID getReportId() {
        return reportId;
    }
}
