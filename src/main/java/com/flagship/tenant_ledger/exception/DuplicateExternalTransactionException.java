package com.flagship.tenant_ledger.exception;

public class DuplicateExternalTransactionException extends LedgerException {

    public DuplicateExternalTransactionException(String externalTransactionId) {
        super("DUPLICATE_EXTERNAL_TRANSACTION",
                "External transaction already bound to an active ledger entry: " + externalTransactionId);
    }
}
