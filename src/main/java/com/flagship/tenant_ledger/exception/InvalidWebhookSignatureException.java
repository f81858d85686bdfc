package com.flagship.tenant_ledger.exception;

public class InvalidWebhookSignatureException extends LedgerException {

    public InvalidWebhookSignatureException(String message) {
        super("INVALID_WEBHOOK_SIGNATURE", message);
    }
}
