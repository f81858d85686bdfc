package com.flagship.tenant_ledger.transactionlog;

/**
 * Kind of gateway interaction recorded in the transaction log.
 * The prefix marks locally generated correlation ids so they are recognisable in gateway dashboards.
 */
public enum OperationType {
    PAYMENT("CI-"),
    WITHDRAWAL("CO-"),
    WEBHOOK("WH-"),
    BALANCE_CHECK("BC-"),
    STATUS_CHECK("SC-");

    private final String correlationPrefix;

    OperationType(String correlationPrefix) {
        this.correlationPrefix = correlationPrefix;
    }

    public String getCorrelationPrefix() {
        return correlationPrefix;
    }
}
