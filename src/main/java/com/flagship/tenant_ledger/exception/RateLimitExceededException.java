package com.flagship.tenant_ledger.exception;

public class RateLimitExceededException extends LedgerException {

    public RateLimitExceededException(Long tenantId, long attempts, long limit) {
        super("RATE_LIMITED", String.format(
                "Withdrawal rate limit reached for tenant %d: %d of %d requests today",
                tenantId, attempts, limit));
    }
}
