package com.flagship.tenant_ledger.exception;

/**
 * The gateway did not answer in time. The outcome of the call is unknown.
 */
public class GatewayTimeoutException extends GatewayOutcomeUnknownException {

    public GatewayTimeoutException(String message, Throwable cause) {
        super("GATEWAY_TIMEOUT", message, null, cause);
    }
}
