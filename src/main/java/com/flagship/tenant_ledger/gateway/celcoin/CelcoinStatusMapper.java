package com.flagship.tenant_ledger.gateway.celcoin;

import com.flagship.tenant_ledger.gateway.GatewayTransactionStatus;

import java.util.Locale;

/**
 * Maps Celcoin status strings onto the ledger's status vocabulary.
 * Anything unrecognised is UNKNOWN, never assumed success or failure.
 */
final class CelcoinStatusMapper {

    private CelcoinStatusMapper() {
    }

    static GatewayTransactionStatus map(String status) {
        if (status == null || status.isBlank()) {
            return GatewayTransactionStatus.UNKNOWN;
        }
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "completed", "confirmed", "approved", "paid", "success", "settled" -> GatewayTransactionStatus.COMPLETED;
            case "pending", "created", "waiting", "active" -> GatewayTransactionStatus.PENDING;
            case "processing", "in_process", "in_progress" -> GatewayTransactionStatus.PROCESSING;
            case "failed", "rejected", "error", "refused" -> GatewayTransactionStatus.FAILED;
            case "cancelled", "canceled" -> GatewayTransactionStatus.CANCELLED;
            case "expired" -> GatewayTransactionStatus.EXPIRED;
            default -> GatewayTransactionStatus.UNKNOWN;
        };
    }
}
