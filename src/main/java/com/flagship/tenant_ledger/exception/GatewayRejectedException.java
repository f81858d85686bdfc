package com.flagship.tenant_ledger.exception;

public class GatewayRejectedException extends GatewayException {

    private final String responseBody;

    public GatewayRejectedException(String message, Integer httpStatus, String responseBody) {
        super("GATEWAY_REJECTED", message, httpStatus, null);
        this.responseBody = responseBody;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
