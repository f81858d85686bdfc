package com.flagship.tenant_ledger.ledger;

/**
 * Lifecycle of a ledger entry. Only CONFIRMED entries count toward the balance.
 */
public enum EntryStatus {
    PENDING,
    CONFIRMED,
    FAILED,
    REVERSED;

    public boolean canTransitionTo(EntryStatus target) {
        return switch (this) {
            case PENDING -> target == CONFIRMED || target == FAILED || target == REVERSED;
            case CONFIRMED -> target == REVERSED;
            case FAILED, REVERSED -> false;
        };
    }

    public boolean isTerminal() {
        return this == FAILED || this == REVERSED;
    }
}
