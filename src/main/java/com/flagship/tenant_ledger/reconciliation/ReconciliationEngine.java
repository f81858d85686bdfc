package com.flagship.tenant_ledger.reconciliation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tenant_ledger.config.LedgerProperties;
import com.flagship.tenant_ledger.gateway.GatewayAdapter;
import com.flagship.tenant_ledger.gateway.GatewayCallExecutor;
import com.flagship.tenant_ledger.gateway.GatewayStatementItem;
import com.flagship.tenant_ledger.gateway.GatewayTransactionStatus;
import com.flagship.tenant_ledger.ledger.EntryType;
import com.flagship.tenant_ledger.ledger.LedgerEntry;
import com.flagship.tenant_ledger.ledger.LedgerStore;
import com.flagship.tenant_ledger.observability.LedgerMetrics;
import com.flagship.tenant_ledger.tenant.GatewayAccountDirectory;
import com.flagship.tenant_ledger.transactionlog.OperationType;
import com.flagship.tenant_ledger.transactionlog.TransactionLog;
import com.flagship.tenant_ledger.transactionlog.TransactionLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Compares each tenant's ledger with what the gateway reports.
 *
 * Differences are reported on the audit channel and persisted; the ledger is
 * never corrected here. Gateway reads go through the idempotent executor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationEngine {

    private static final List<EntryType> RECONCILED_TYPES = List.of(EntryType.CASH_IN, EntryType.CASH_OUT);

    private final LedgerStore ledgerStore;
    private final GatewayAdapter gatewayAdapter;
    private final GatewayCallExecutor gatewayCallExecutor;
    private final GatewayAccountDirectory accountDirectory;
    private final TransactionLogService transactionLogService;
    private final ReconciliationReportService reportService;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final ObjectMapper objectMapper;

    /**
     * Compares the confirmed balance with the gateway's available balance. When
     * they differ by the tolerance or more, the recent statement is diffed
     * transaction by transaction.
     */
    public BalanceSyncResult syncBalance(Long tenantId) {
        String accountId = accountDirectory.resolveExternalAccountId(tenantId);

        BigDecimal internal = ledgerStore.getBalance(tenantId);
        BigDecimal external = gatewayCallExecutor.executeIdempotent("getBalance",
                () -> gatewayAdapter.getBalance(accountId));
        BigDecimal difference = internal.subtract(external);
        boolean reconciled = difference.abs().compareTo(properties.getReconciliation().getTolerance()) < 0;

        recordBalanceCheck(tenantId, internal, external, reconciled);

        Instant periodEnd = Instant.now();
        Instant periodStart = periodEnd.minus(properties.getReconciliation().getStatementLookback());

        List<Discrepancy> discrepancies = List.of();
        if (!reconciled) {
            log.warn("Balance mismatch: tenantId={}, internal={}, external={}, difference={}",
                    tenantId, internal, external, difference);
            DiscrepancyReport report = reconcileTransactions(tenantId, accountId, periodStart, periodEnd);
            discrepancies = report.getDiscrepancies();
        }

        UUID reportId = reportService.save(tenantId, periodStart, periodEnd, internal, external,
                reconciled, discrepancies);
        metrics.recordReconciliation(reconciled, discrepancies.size());

        log.info("Balance sync finished: tenantId={}, reportId={}, reconciled={}, difference={}, discrepancies={}",
                tenantId, reportId, reconciled, difference, discrepancies.size());

        return BalanceSyncResult.builder()
                .reportId(reportId)
                .tenantId(tenantId)
                .internalBalance(internal)
                .externalBalance(external)
                .difference(difference)
                .reconciled(reconciled)
                .discrepancies(reconciled ? null : discrepancies)
                .checkedAt(periodEnd)
                .build();
    }

    public DiscrepancyReport reconcileTransactions(Long tenantId, Instant from, Instant to) {
        return reconcileTransactions(tenantId, accountDirectory.resolveExternalAccountId(tenantId), from, to);
    }

    /**
     * Diffs confirmed CASH_IN and CASH_OUT entries against the gateway statement.
     *
     * Entries are matched by gateway transaction id, then by the correlation id
     * stored in their metadata. Only completed statement items count.
     */
    DiscrepancyReport reconcileTransactions(Long tenantId, String accountId, Instant from, Instant to) {
        List<LedgerEntry> entries = ledgerStore.findConfirmedBetween(tenantId, RECONCILED_TYPES, from, to);
        List<GatewayStatementItem> statement = gatewayCallExecutor.executeIdempotent("getStatement",
                () -> gatewayAdapter.getStatement(accountId, from, to));

        Map<String, GatewayStatementItem> byExternalId = new HashMap<>();
        Map<String, GatewayStatementItem> byCorrelationId = new HashMap<>();
        for (GatewayStatementItem item : statement) {
            if (item.getStatus() != null && item.getStatus() != GatewayTransactionStatus.COMPLETED) {
                continue;
            }
            if (item.getExternalId() != null) {
                byExternalId.put(item.getExternalId(), item);
            }
            if (item.getCorrelationId() != null) {
                byCorrelationId.put(item.getCorrelationId(), item);
            }
        }

        List<Discrepancy> discrepancies = new ArrayList<>();
        Set<GatewayStatementItem> matched = new HashSet<>();

        for (LedgerEntry entry : entries) {
            GatewayStatementItem item = entry.getExternalTransactionId() != null
                    ? byExternalId.get(entry.getExternalTransactionId())
                    : null;
            if (item == null) {
                Object correlationId = entry.getMetadata() != null ? entry.getMetadata().get("correlationId") : null;
                item = correlationId != null ? byCorrelationId.get(correlationId.toString()) : null;
            }

            if (item == null) {
                discrepancies.add(Discrepancy.builder()
                        .type(DiscrepancyType.MISSING_AT_GATEWAY)
                        .entryId(entry.getId())
                        .externalTransactionId(entry.getExternalTransactionId())
                        .ledgerAmount(entry.getAmount())
                        .detail(entry.getType() + " " + entry.getReferenceId())
                        .build());
                continue;
            }

            matched.add(item);
            if (item.getAmount() == null || item.getAmount().compareTo(entry.getAmount()) != 0) {
                discrepancies.add(Discrepancy.builder()
                        .type(DiscrepancyType.AMOUNT_MISMATCH)
                        .entryId(entry.getId())
                        .externalTransactionId(item.getExternalId())
                        .ledgerAmount(entry.getAmount())
                        .gatewayAmount(item.getAmount())
                        .detail(entry.getType() + " " + entry.getReferenceId())
                        .build());
            }
        }

        Set<GatewayStatementItem> completed = new HashSet<>(byExternalId.values());
        completed.addAll(byCorrelationId.values());
        for (GatewayStatementItem item : completed) {
            if (!matched.contains(item)) {
                discrepancies.add(Discrepancy.builder()
                        .type(DiscrepancyType.MISSING_IN_LEDGER)
                        .externalTransactionId(item.getExternalId())
                        .gatewayAmount(item.getAmount())
                        .detail(item.getCorrelationId() != null ? "correlationId " + item.getCorrelationId() : null)
                        .build());
            }
        }

        log.info("Transaction reconciliation: tenantId={}, from={}, to={}, entries={}, statementItems={}, discrepancies={}",
                tenantId, from, to, entries.size(), statement.size(), discrepancies.size());
        return new DiscrepancyReport(tenantId, from, to, entries.size(), statement.size(), discrepancies);
    }

    private void recordBalanceCheck(Long tenantId, BigDecimal internal, BigDecimal external, boolean reconciled) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("internalBalance", internal);
        snapshot.put("externalBalance", external);
        snapshot.put("reconciled", reconciled);

        TransactionLog check = TransactionLog.start(tenantId, OperationType.BALANCE_CHECK, null, external, null);
        transactionLogService.record(check.toBuilder()
                .responsePayload(toJson(snapshot))
                .gatewayStatus(reconciled ? "RECONCILED" : "MISMATCH")
                .successful(true)
                .build());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize balance snapshot", e);
        }
    }
}
