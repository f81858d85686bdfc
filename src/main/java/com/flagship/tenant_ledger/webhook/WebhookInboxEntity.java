package com.flagship.tenant_ledger.webhook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Every webhook delivery the gateway made, kept raw for disputes.
 *
 * Accepted payloads are deduplicated by hash; a repeat only bumps
 * {@code deliveryCount}. Rejected deliveries are kept one row each.
 */
@Entity
@Table(name = "webhook_inbox")
@Getter
@NoArgsConstructor
public class WebhookInboxEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payload_hash", nullable = false, updatable = false, length = 64)
    private String payloadHash;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "signature", updatable = false)
    private String signature;

    @Column(name = "gateway_transaction_id", updatable = false)
    private String gatewayTransactionId;

    @Column(name = "correlation_id", updatable = false, length = 64)
    private String correlationId;

    @Column(name = "gateway_status", updatable = false, length = 30)
    private String gatewayStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "result", nullable = false, length = 20)
    private WebhookResult result;

    @Column(name = "detail", columnDefinition = "TEXT")
    private String detail;

    @Column(name = "delivery_count", nullable = false)
    private int deliveryCount;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(name = "last_received_at", nullable = false)
    private Instant lastReceivedAt;

    public static WebhookInboxEntity received(String payloadHash, String payload, String signature,
                                              String gatewayTransactionId, String correlationId,
                                              String gatewayStatus, WebhookResult result, String detail) {
        WebhookInboxEntity entity = new WebhookInboxEntity();
        Instant now = Instant.now();
        entity.id = UUID.randomUUID();
        entity.payloadHash = payloadHash;
        entity.payload = payload;
        entity.signature = signature;
        entity.gatewayTransactionId = gatewayTransactionId;
        entity.correlationId = correlationId;
        entity.gatewayStatus = gatewayStatus;
        entity.result = result;
        entity.detail = detail;
        entity.deliveryCount = 1;
        entity.receivedAt = now;
        entity.lastReceivedAt = now;
        return entity;
    }

    public void redelivered() {
        this.deliveryCount++;
        this.lastReceivedAt = Instant.now();
    }
}
