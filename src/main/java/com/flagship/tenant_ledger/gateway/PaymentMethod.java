package com.flagship.tenant_ledger.gateway;

public enum PaymentMethod {
    /** Instant transfer, settled through a QR code or copy-paste key. */
    PIX,
    /** Deferred invoice, settled when the barcode is paid. */
    BOLETO
}
