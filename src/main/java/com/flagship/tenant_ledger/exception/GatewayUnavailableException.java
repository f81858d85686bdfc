package com.flagship.tenant_ledger.exception;

/**
 * The gateway could not be reached or answered with a server error.
 */
public class GatewayUnavailableException extends GatewayException {

    public GatewayUnavailableException(String message, Integer httpStatus, Throwable cause) {
        super("GATEWAY_UNAVAILABLE", message, httpStatus, cause);
    }
}
