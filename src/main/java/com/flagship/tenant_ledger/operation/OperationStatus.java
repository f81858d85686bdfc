package com.flagship.tenant_ledger.operation;

public enum OperationStatus {
    COMPLETED,
    /** Accepted but not settled: waiting for the gateway, or outcome unknown after a timeout. */
    PENDING,
    FAILED
}
