package com.flagship.tenant_ledger.exception;

public class GatewayAuthenticationException extends GatewayException {

    public GatewayAuthenticationException(String message, Integer httpStatus, Throwable cause) {
        super("GATEWAY_AUTHENTICATION", message, httpStatus, cause);
    }
}
