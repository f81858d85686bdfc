package com.flagship.tenant_ledger.transactionlog;

import com.flagship.tenant_ledger.gateway.GatewayTransactionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for the gateway transaction log.
 *
 * There are no setters: the only way to change a row after insert is
 * {@link #merge(TransactionLogUpdate, Instant)}, which never destroys a value
 * that was already recorded.
 */
@Entity
@Table(name = "gateway_transaction_log")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Slf4j
public class TransactionLogEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", updatable = false)
    private Long tenantId;

    @Column(name = "correlation_id", nullable = false, updatable = false, length = 64)
    private String correlationId;

    @Column(name = "gateway_transaction_id")
    private String gatewayTransactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation_type", nullable = false, updatable = false, length = 20)
    private OperationType operationType;

    @Column(name = "reference_id", updatable = false)
    private String referenceId;

    @Column(name = "amount", precision = 19, scale = 2, updatable = false)
    private BigDecimal amount;

    @Column(name = "ledger_entry_id")
    private UUID ledgerEntryId;

    @Column(name = "request_payload", columnDefinition = "jsonb", updatable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String requestPayload;

    @Column(name = "response_payload", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String responsePayload;

    @Column(name = "webhook_payload", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String webhookPayload;

    @Column(name = "webhook_payload_hash", length = 64)
    private String webhookPayloadHash;

    @Column(name = "http_status")
    private Integer httpStatus;

    @Column(name = "gateway_status", length = 30)
    private String gatewayStatus;

    @Column(name = "fee", precision = 19, scale = 2)
    private BigDecimal fee;

    @Column(name = "net_amount", precision = 19, scale = 2)
    private BigDecimal netAmount;

    @Column(name = "successful")
    private Boolean successful;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "webhook_received", nullable = false)
    private boolean webhookReceived;

    @Column(name = "webhook_timestamp")
    private Instant webhookTimestamp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static TransactionLogEntity fromDomain(TransactionLog log) {
        TransactionLogEntity entity = new TransactionLogEntity();
        entity.id = log.getId();
        entity.tenantId = log.getTenantId();
        entity.correlationId = log.getCorrelationId();
        entity.gatewayTransactionId = log.getGatewayTransactionId();
        entity.operationType = log.getOperationType();
        entity.referenceId = log.getReferenceId();
        entity.amount = log.getAmount();
        entity.ledgerEntryId = log.getLedgerEntryId();
        entity.requestPayload = log.getRequestPayload();
        entity.responsePayload = log.getResponsePayload();
        entity.webhookPayload = log.getWebhookPayload();
        entity.webhookPayloadHash = log.getWebhookPayloadHash();
        entity.httpStatus = log.getHttpStatus();
        entity.gatewayStatus = log.getGatewayStatus();
        entity.fee = log.getFee();
        entity.netAmount = log.getNetAmount();
        entity.successful = log.getSuccessful();
        entity.errorMessage = log.getErrorMessage();
        entity.webhookReceived = log.isWebhookReceived();
        entity.webhookTimestamp = log.getWebhookTimestamp();
        entity.createdAt = log.getCreatedAt() != null ? log.getCreatedAt() : Instant.now();
        entity.updatedAt = log.getUpdatedAt() != null ? log.getUpdatedAt() : entity.createdAt;
        return entity;
    }

    public TransactionLog toDomain() {
        return TransactionLog.builder()
                .id(id)
                .tenantId(tenantId)
                .correlationId(correlationId)
                .gatewayTransactionId(gatewayTransactionId)
                .operationType(operationType)
                .referenceId(referenceId)
                .amount(amount)
                .ledgerEntryId(ledgerEntryId)
                .requestPayload(requestPayload)
                .responsePayload(responsePayload)
                .webhookPayload(webhookPayload)
                .webhookPayloadHash(webhookPayloadHash)
                .httpStatus(httpStatus)
                .gatewayStatus(gatewayStatus)
                .fee(fee)
                .netAmount(netAmount)
                .successful(successful)
                .errorMessage(errorMessage)
                .webhookReceived(webhookReceived)
                .webhookTimestamp(webhookTimestamp)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    /**
     * Applies a partial update.
     *
     * Identifiers, the synchronous response and the first error are write-once.
     * Status fields take the latest non-null value until a terminal gateway
     * status is stored; from then on the status and the success flag no longer
     * move, whichever path reported them first. Webhook fields are replaced
     * only when the payload hash differs from the stored one.
     *
     * @return true if any stored value changed
     */
    public boolean merge(TransactionLogUpdate update, Instant now) {
        boolean changed = false;
        boolean settled = GatewayTransactionStatus.isTerminalName(gatewayStatus);

        if (update.getGatewayTransactionId() != null) {
            if (gatewayTransactionId == null) {
                gatewayTransactionId = update.getGatewayTransactionId();
                changed = true;
            } else if (!gatewayTransactionId.equals(update.getGatewayTransactionId())) {
                log.warn("Ignoring conflicting gateway id for correlationId={}: stored={}, received={}",
                        correlationId, gatewayTransactionId, update.getGatewayTransactionId());
            }
        }
        if (ledgerEntryId == null && update.getLedgerEntryId() != null) {
            ledgerEntryId = update.getLedgerEntryId();
            changed = true;
        }
        if (responsePayload == null && update.getResponsePayload() != null) {
            responsePayload = update.getResponsePayload();
            changed = true;
        }
        if (httpStatus == null && update.getHttpStatus() != null) {
            httpStatus = update.getHttpStatus();
            changed = true;
        }
        if (errorMessage == null && update.getErrorMessage() != null) {
            errorMessage = update.getErrorMessage();
            changed = true;
        }
        if (update.getGatewayStatus() != null && !update.getGatewayStatus().equals(gatewayStatus)) {
            if (!settled) {
                gatewayStatus = update.getGatewayStatus();
                changed = true;
            } else if (GatewayTransactionStatus.isTerminalName(update.getGatewayStatus())) {
                log.warn("Ignoring conflicting terminal status for correlationId={}: stored={}, received={}",
                        correlationId, gatewayStatus, update.getGatewayStatus());
            } else {
                log.debug("Keeping terminal status {} for correlationId={}, received {}",
                        gatewayStatus, correlationId, update.getGatewayStatus());
            }
        }
        if (update.getFee() != null && !sameAmount(update.getFee(), fee)) {
            fee = update.getFee();
            changed = true;
        }
        if (update.getNetAmount() != null && !sameAmount(update.getNetAmount(), netAmount)) {
            netAmount = update.getNetAmount();
            changed = true;
        }
        if (!settled && update.getSuccessful() != null && !update.getSuccessful().equals(successful)) {
            successful = update.getSuccessful();
            changed = true;
        }
        if (update.getWebhookPayload() != null) {
            String hash = PayloadDigest.sha256Hex(update.getWebhookPayload());
            if (!hash.equals(webhookPayloadHash)) {
                webhookPayload = update.getWebhookPayload();
                webhookPayloadHash = hash;
                webhookReceived = true;
                webhookTimestamp = update.getWebhookTimestamp() != null ? update.getWebhookTimestamp() : now;
                changed = true;
            }
        }

        if (changed) {
            updatedAt = now;
        }
        return changed;
    }

    private static boolean sameAmount(BigDecimal a, BigDecimal b) {
        return Objects.equals(a, b) || (a != null && b != null && a.compareTo(b) == 0);
    }
}
