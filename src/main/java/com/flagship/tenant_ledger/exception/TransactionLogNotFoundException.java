package com.flagship.tenant_ledger.exception;

public class TransactionLogNotFoundException extends LedgerException {

    public TransactionLogNotFoundException(String key) {
        super("TRANSACTION_LOG_NOT_FOUND", "Transaction log not found: " + key);
    }
}
