package com.flagship.tenant_ledger.operation;

import com.flagship.tenant_ledger.audit.AuditChannel;
import com.flagship.tenant_ledger.audit.event.PendingEscalationEvent;
import com.flagship.tenant_ledger.config.LedgerProperties;
import com.flagship.tenant_ledger.exception.GatewayException;
import com.flagship.tenant_ledger.gateway.GatewayAdapter;
import com.flagship.tenant_ledger.gateway.GatewayCallExecutor;
import com.flagship.tenant_ledger.gateway.GatewayTransactionStatus;
import com.flagship.tenant_ledger.ledger.LedgerEntry;
import com.flagship.tenant_ledger.ledger.LedgerStore;
import com.flagship.tenant_ledger.observability.CorrelationContext;
import com.flagship.tenant_ledger.observability.LedgerMetrics;
import com.flagship.tenant_ledger.outbox.OutboxService;
import com.flagship.tenant_ledger.transactionlog.OperationType;
import com.flagship.tenant_ledger.transactionlog.TransactionLog;
import com.flagship.tenant_ledger.transactionlog.TransactionLogService;
import com.flagship.tenant_ledger.transactionlog.TransactionLogUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Settles entries the gateway never confirmed through a webhook.
 *
 * Entries pending longer than {@code ledger.pending.max-age} are checked against
 * the gateway's status endpoint. Those it cannot settle are escalated to
 * operators once; they are never auto-failed. Gateway calls whose outcome was
 * never learned and that produced no entry are escalated the same way.
 *
 * Each item is isolated: one failure is logged and the batch continues.
 */
@Component
@ConditionalOnProperty(name = "ledger.scheduling.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PendingEntryResolver {

    private static final String ENTRY_AGGREGATE = "LedgerEntry";

    private final LedgerStore ledgerStore;
    private final LedgerPostingService postingService;
    private final TransactionLogService transactionLogService;
    private final GatewayAdapter gatewayAdapter;
    private final GatewayCallExecutor gatewayCallExecutor;
    private final OutboxService outboxService;
    private final AuditChannel auditChannel;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;

    @Scheduled(fixedDelayString = "${ledger.pending.resolver-interval-ms:60000}")
    public void resolve() {
        Instant cutoff = Instant.now().minus(properties.getPending().getMaxAge());
        int batchSize = properties.getPending().getResolverBatchSize();

        List<LedgerEntry> stale = ledgerStore.findPendingOlderThan(cutoff, batchSize);
        if (!stale.isEmpty()) {
            log.info("Resolving {} stale pending entries older than {}", stale.size(), cutoff);
        }
        for (LedgerEntry entry : stale) {
            MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, String.valueOf(entry.getTenantId()));
            MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entry.getId().toString());
            try {
                resolveEntry(entry);
            } catch (Exception e) {
                metrics.recordPendingResolution("error");
                log.error("Failed to resolve pending entry {}: {}", entry.getId(), e.getMessage(), e);
            } finally {
                MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
                MDC.remove(CorrelationContext.TENANT_ID_MDC_KEY);
            }
        }

        for (TransactionLog attempt : transactionLogService.findAwaitingOutcomeBefore(cutoff, batchSize)) {
            if (attempt.getLedgerEntryId() != null) {
                continue;   // covered by the entry pass
            }
            try {
                log.warn("Escalating gateway call with unknown outcome: correlationId={}, referenceId={}",
                        attempt.getCorrelationId(), attempt.getReferenceId());
                postingService.escalateUnknownOutcome(attempt,
                        "no gateway outcome after " + properties.getPending().getMaxAge());
                metrics.recordPendingResolution("escalated");
            } catch (Exception e) {
                metrics.recordPendingResolution("error");
                log.error("Failed to escalate transaction log {}: {}", attempt.getCorrelationId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Queries the gateway for one stale entry and applies what it reports.
     */
    SettlementOutcome resolveEntry(LedgerEntry entry) {
        Optional<TransactionLog> origin = transactionLogService.findByLedgerEntryId(entry.getId());
        String externalId = entry.getExternalTransactionId() != null
                ? entry.getExternalTransactionId()
                : origin.map(TransactionLog::getGatewayTransactionId).orElse(null);

        if (externalId == null) {
            escalateOnce(entry, origin, null, "gateway transaction id never assigned");
            return SettlementOutcome.STILL_PENDING;
        }

        GatewayTransactionStatus status;
        try {
            status = gatewayCallExecutor.executeIdempotent("getStatus", () -> gatewayAdapter.getStatus(externalId));
        } catch (GatewayException e) {
            log.warn("Status query failed for entry {}: errorCode={}, message={}",
                    entry.getId(), e.getErrorCode(), e.getMessage());
            escalateOnce(entry, origin, null, "status query failed: " + e.getErrorCode());
            return SettlementOutcome.STILL_PENDING;
        }

        recordStatusCheck(entry, externalId, status);
        origin.filter(attempt -> status.isTerminal())
                .ifPresent(attempt -> transactionLogService.update(attempt.getCorrelationId(),
                        TransactionLogUpdate.builder()
                                .gatewayTransactionId(externalId)
                                .gatewayStatus(status.name())
                                .successful(status.isTerminalSuccess())
                                .build()));

        SettlementOutcome outcome = postingService.settle(entry.getId(), externalId, status,
                "gateway status query: " + status);
        metrics.recordPendingResolution(outcome.name());
        log.info("Pending entry resolved: entryId={}, externalId={}, gatewayStatus={}, outcome={}",
                entry.getId(), externalId, status, outcome);

        if (outcome == SettlementOutcome.STILL_PENDING) {
            escalateOnce(entry, origin, status.name(), "still " + status + " at the gateway");
        }
        return outcome;
    }

    private void recordStatusCheck(LedgerEntry entry, String externalId, GatewayTransactionStatus status) {
        TransactionLog check = TransactionLog.start(entry.getTenantId(), OperationType.STATUS_CHECK,
                entry.getReferenceId(), entry.getAmount().abs(), null);
        transactionLogService.record(check.toBuilder()
                .gatewayTransactionId(externalId)
                .ledgerEntryId(entry.getId())
                .gatewayStatus(status.name())
                .successful(true)
                .build());
    }

    private void escalateOnce(LedgerEntry entry, Optional<TransactionLog> origin, String gatewayStatus, String reason) {
        boolean alreadyEscalated = outboxService.getEventsForAggregate(ENTRY_AGGREGATE, entry.getId()).stream()
                .anyMatch(event -> PendingEscalationEvent.EVENT_TYPE.equals(event.getEventType()));
        if (alreadyEscalated) {
            log.debug("Entry {} already escalated", entry.getId());
            return;
        }

        Instant now = Instant.now();
        auditChannel.reportPendingEscalation(PendingEscalationEvent.builder()
                .eventId(UUID.randomUUID())
                .tenantId(entry.getTenantId())
                .entryId(entry.getId())
                .correlationId(origin.map(TransactionLog::getCorrelationId).orElse(null))
                .referenceId(entry.getReferenceId())
                .externalTransactionId(entry.getExternalTransactionId())
                .amount(entry.getAmount())
                .gatewayStatus(gatewayStatus)
                .ageSeconds(entry.getCreatedAt() != null ? Duration.between(entry.getCreatedAt(), now).getSeconds() : 0)
                .reason(reason)
                .occurredAt(now)
                .build());
        metrics.recordPendingResolution("escalated");
    }
}
