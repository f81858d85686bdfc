package com.flagship.tenant_ledger.reconciliation;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Per-transaction differences between the ledger and the gateway statement for one period.
 */
@Value
public class DiscrepancyReport {
    Long tenantId;
    Instant periodStart;
    Instant periodEnd;
    int ledgerEntriesChecked;
    int gatewayItemsChecked;
    List<Discrepancy> discrepancies;

    public boolean isClean() {
        return discrepancies.isEmpty();
    }
}
