package com.flagship.tenant_ledger.exception;

import java.math.BigDecimal;

public class InsufficientBalanceException extends LedgerException {

    private final Long tenantId;
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientBalanceException(Long tenantId, BigDecimal available, BigDecimal requested) {
        super("INSUFFICIENT_BALANCE", String.format(
                "Insufficient balance for tenant %d: available=%s, requested=%s",
                tenantId, available, requested));
        this.tenantId = tenantId;
        this.available = available;
        this.requested = requested;
    }

    public Long getTenantId() {
        return tenantId;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}
