package com.flagship.tenant_ledger.exception;

/**
 * A money-moving call may have been executed by the gateway, but no usable
 * answer came back. The caller must keep the operation open until a webhook
 * or a status query settles it.
 */
public class GatewayOutcomeUnknownException extends GatewayException {

    public GatewayOutcomeUnknownException(String message, Integer httpStatus, Throwable cause) {
        this("GATEWAY_OUTCOME_UNKNOWN", message, httpStatus, cause);
    }

    protected GatewayOutcomeUnknownException(String errorCode, String message, Integer httpStatus, Throwable cause) {
        super(errorCode, message, httpStatus, cause);
    }
}
