package com.flagship.tenant_ledger.reconciliation;

public enum DiscrepancyType {
    /** Confirmed in the ledger, absent from the gateway statement. */
    MISSING_AT_GATEWAY,
    /** Completed at the gateway, no confirmed entry in the ledger. */
    MISSING_IN_LEDGER,
    /** Present on both sides with different amounts. */
    AMOUNT_MISMATCH
}
