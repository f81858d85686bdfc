package com.flagship.tenant_ledger.audit;

import com.flagship.tenant_ledger.audit.event.AuditEvent;
import com.flagship.tenant_ledger.audit.event.ContradictoryOutcomeEvent;
import com.flagship.tenant_ledger.audit.event.InvalidWebhookSignatureEvent;
import com.flagship.tenant_ledger.audit.event.OrphanWebhookEvent;
import com.flagship.tenant_ledger.audit.event.PendingEscalationEvent;
import com.flagship.tenant_ledger.audit.event.ReconciliationMismatchEvent;
import com.flagship.tenant_ledger.gateway.GatewayWebhookEvent;
import com.flagship.tenant_ledger.ledger.LedgerEntry;
import com.flagship.tenant_ledger.outbox.OutboxEvent;
import com.flagship.tenant_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Operator-facing alerts, routed through the outbox to the audit topic.
 *
 * Each method joins the caller's transaction when there is one, so an alert
 * is never published for a change that rolled back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditChannel {

    private final OutboxService outboxService;

    /**
     * A tenant's alerts of one type, oldest first, whether or not they were published yet.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> history(Long tenantId, String eventType) {
        return outboxService.getEventsForTenant(tenantId, eventType);
    }

    @Transactional
    public void reportReconciliationMismatch(Long tenantId, UUID reportId, BigDecimal internalBalance,
                                             BigDecimal externalBalance, int discrepancyCount) {
        ReconciliationMismatchEvent event = new ReconciliationMismatchEvent(
                UUID.randomUUID(), tenantId, reportId, internalBalance, externalBalance,
                internalBalance.subtract(externalBalance), discrepancyCount, Instant.now());
        log.warn("Reconciliation mismatch: tenantId={}, reportId={}, internal={}, external={}, discrepancies={}",
                tenantId, reportId, internalBalance, externalBalance, discrepancyCount);
        publish("ReconciliationReport", reportId, event);
    }

    @Transactional
    public void reportOrphanWebhook(UUID inboxId, GatewayWebhookEvent webhook) {
        OrphanWebhookEvent event = new OrphanWebhookEvent(
                UUID.randomUUID(), inboxId, webhook.getGatewayTransactionId(), webhook.getCorrelationId(),
                webhook.getStatus() != null ? webhook.getStatus().name() : null, webhook.getAmount(), Instant.now());
        log.warn("Orphan webhook: inboxId={}, gatewayTransactionId={}, correlationId={}",
                inboxId, webhook.getGatewayTransactionId(), webhook.getCorrelationId());
        publish("WebhookInbox", inboxId, event);
    }

    @Transactional
    public void reportInvalidSignature(UUID inboxId, String payloadHash, boolean signaturePresent) {
        InvalidWebhookSignatureEvent event = new InvalidWebhookSignatureEvent(
                UUID.randomUUID(), inboxId, payloadHash, signaturePresent, Instant.now());
        log.warn("Webhook rejected for invalid signature: inboxId={}, signaturePresent={}", inboxId, signaturePresent);
        publish("WebhookInbox", inboxId, event);
    }

    @Transactional
    public void reportPendingEscalation(PendingEscalationEvent event) {
        log.warn("Pending escalation: tenantId={}, entryId={}, correlationId={}, ageSeconds={}, reason={}",
                event.getTenantId(), event.getEntryId(), event.getCorrelationId(),
                event.getAgeSeconds(), event.getReason());
        UUID aggregateId = event.getEntryId() != null ? event.getEntryId() : event.getEventId();
        publish(event.getEntryId() != null ? "LedgerEntry" : "TransactionLog", aggregateId, event);
    }

    @Transactional
    public void reportContradictoryOutcome(LedgerEntry entry, String gatewayTransactionId, String gatewayStatus) {
        ContradictoryOutcomeEvent event = new ContradictoryOutcomeEvent(
                UUID.randomUUID(), entry.getTenantId(), entry.getId(), gatewayTransactionId,
                entry.getStatus().name(), gatewayStatus, Instant.now());
        log.error("Gateway outcome contradicts ledger: entryId={}, tenantId={}, ledgerStatus={}, gatewayStatus={}",
                entry.getId(), entry.getTenantId(), entry.getStatus(), gatewayStatus);
        publish("LedgerEntry", entry.getId(), event);
    }

    private void publish(String aggregateType, UUID aggregateId, AuditEvent event) {
        outboxService.saveEvent(aggregateType, aggregateId, event.getTenantId(), event.getEventType(), event);
    }
}
