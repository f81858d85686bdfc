package com.flagship.tenant_ledger.exception;

import java.math.BigDecimal;

/**
 * Raised when a debit would push the tenant past its daily withdrawal amount.
 */
public class WithdrawalLimitExceededException extends LedgerException {

    public WithdrawalLimitExceededException(Long tenantId, BigDecimal withdrawnToday,
                                            BigDecimal requested, BigDecimal limit) {
        super("WITHDRAWAL_LIMIT_EXCEEDED", String.format(
                "Daily withdrawal limit reached for tenant %d: withdrawnToday=%s, requested=%s, limit=%s",
                tenantId, withdrawnToday, requested, limit));
    }
}
