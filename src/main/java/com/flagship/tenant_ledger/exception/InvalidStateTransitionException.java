package com.flagship.tenant_ledger.exception;

import java.util.UUID;

public class InvalidStateTransitionException extends LedgerException {

    public InvalidStateTransitionException(UUID entryId, String from, String to) {
        super("INVALID_STATE_TRANSITION", String.format(
                "Ledger entry %s cannot move from %s to %s", entryId, from, to));
    }

    public InvalidStateTransitionException(String message) {
        super("INVALID_STATE_TRANSITION", message);
    }
}
