package com.flagship.tenant_ledger.ledger;

/**
 * Kind of monetary fact recorded for a tenant.
 *
 * The sign of the amount encodes direction: CASH_IN is always a credit,
 * CASH_OUT and FEE are always debits, the others may carry either sign.
 */
public enum EntryType {
    CASH_IN,
    CASH_OUT,
    FEE,
    COMMISSION,
    ADJUSTMENT,
    REVERSAL
}
