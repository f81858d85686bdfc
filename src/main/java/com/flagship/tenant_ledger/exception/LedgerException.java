package com.flagship.tenant_ledger.exception;

/**
 * Base type for every failure raised by the ledger core.
 *
 * Each subtype carries a stable error code that is surfaced unchanged in
 * operation results and API error bodies.
 */
public abstract class LedgerException extends RuntimeException {

    private final String errorCode;

    protected LedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
