package com.flagship.tenant_ledger.operation;

/**
 * Business outcomes reported in an {@link OperationResult} instead of thrown.
 */
public enum ErrorCode {
    INSUFFICIENT_BALANCE,
    WITHDRAWAL_LIMIT_EXCEEDED,
    RATE_LIMITED,
    GATEWAY_REJECTED,
    GATEWAY_ERROR,
    TENANT_ACCOUNT_NOT_FOUND,
    VALIDATION_ERROR
}
