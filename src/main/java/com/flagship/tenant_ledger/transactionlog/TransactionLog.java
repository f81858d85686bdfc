package com.flagship.tenant_ledger.transactionlog;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One outbound gateway call or inbound webhook, as recorded in the forensic trail.
 *
 * The row is written before the call leaves the process, merged once with the
 * synchronous response and merged again, idempotently, when the webhook arrives.
 */
@Value
@Builder(toBuilder = true)
public class TransactionLog {
    UUID id;
    Long tenantId;
    String correlationId;           // locally generated, known before the call
    String gatewayTransactionId;    // assigned by the gateway
    OperationType operationType;
    String referenceId;
    BigDecimal amount;
    UUID ledgerEntryId;
    String requestPayload;
    String responsePayload;
    String webhookPayload;
    String webhookPayloadHash;
    Integer httpStatus;
    String gatewayStatus;
    BigDecimal fee;
    BigDecimal netAmount;
    Boolean successful;             // null while the outcome is unknown
    String errorMessage;
    boolean webhookReceived;
    Instant webhookTimestamp;
    Instant createdAt;
    Instant updatedAt;

    public static String newCorrelationId(OperationType operationType) {
        return operationType.getCorrelationPrefix() + UUID.randomUUID();
    }

    /**
     * Creates the row written before an outbound call.
     */
    public static TransactionLog start(Long tenantId, OperationType operationType, String referenceId,
                                       BigDecimal amount, String requestPayload) {
        Instant now = Instant.now();
        return TransactionLog.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .correlationId(newCorrelationId(operationType))
                .operationType(operationType)
                .referenceId(referenceId)
                .amount(amount)
                .requestPayload(requestPayload)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * True while neither a definitive response nor a webhook has settled the call,
     * including after a timeout.
     */
    public boolean isAwaitingOutcome() {
        return successful == null;
    }

    public boolean hasGatewayTransaction() {
        return gatewayTransactionId != null;
    }
}
