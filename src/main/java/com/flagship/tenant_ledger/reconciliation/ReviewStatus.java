package com.flagship.tenant_ledger.reconciliation;

/**
 * Operator follow-up on a reconciliation report.
 */
public enum ReviewStatus {
    /** The balances agreed. */
    NOT_REQUIRED,
    /** The balances disagreed and nobody has looked yet. */
    PENDING_REVIEW,
    /** An operator explained or corrected the difference. */
    RESOLVED,
    /** An operator judged the difference not worth acting on. */
    DISMISSED;

    public boolean isClosing() {
        return this == RESOLVED || this == DISMISSED;
    }
}
