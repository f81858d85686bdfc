package com.flagship.tenant_ledger.operation;

/**
 * What applying a gateway status to a ledger entry did.
 */
public enum SettlementOutcome {
    CONFIRMED,
    FAILED,
    REVERSED,
    /** The entry already carried this outcome. */
    ALREADY_SETTLED,
    /** Non-terminal gateway status; the entry stays pending. */
    STILL_PENDING,
    /** The gateway reports the opposite of what the ledger settled; raised on the audit channel. */
    CONTRADICTORY
}
