package com.flagship.tenant_ledger.exception;

/**
 * Failures talking to the external settlement gateway.
 */
public abstract class GatewayException extends LedgerException {

    private final Integer httpStatus;

    protected GatewayException(String errorCode, String message, Integer httpStatus, Throwable cause) {
        super(errorCode, message, cause);
        this.httpStatus = httpStatus;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
