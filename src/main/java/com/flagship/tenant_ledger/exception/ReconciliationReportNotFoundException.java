package com.flagship.tenant_ledger.exception;

import java.util.UUID;

public class ReconciliationReportNotFoundException extends LedgerException {

    public ReconciliationReportNotFoundException(UUID reportId) {
        super("RECONCILIATION_REPORT_NOT_FOUND", "Reconciliation report not found: " + reportId);
    }
}
