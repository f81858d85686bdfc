package com.flagship.tenant_ledger.exception;

import java.util.UUID;

public class EntryNotFoundException extends LedgerException {

    public EntryNotFoundException(UUID entryId) {
        super("ENTRY_NOT_FOUND", "Ledger entry not found: " + entryId);
    }
}
