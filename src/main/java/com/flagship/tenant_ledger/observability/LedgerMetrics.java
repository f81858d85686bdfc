package com.flagship.tenant_ledger.observability;

import com.flagship.tenant_ledger.ledger.LedgerStore;
import com.flagship.tenant_ledger.transactionlog.TransactionLogService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for ledger operations and gateway traffic.
 *
 * Metrics exposed:
 * - ledger.operations: counter by operation and outcome
 * - ledger.operation.duration: timer by operation
 * - ledger.duplicate_requests: idempotency hits
 * - gateway.calls / gateway.call.duration: outbound calls by operation and outcome
 * - ledger.webhooks: inbound webhooks by result
 * - ledger.reconciliation.runs: balance syncs by result
 * - ledger.entries.pending / ledger.gateway.awaiting_outcome: backlog gauges
 */
@Component
@Slf4j
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final LedgerStore ledgerStore;
    private final TransactionLogService transactionLogService;

    private final Counter tokenRefreshes;
    private final Counter invalidSignatures;

    // Refreshed by MetricsScheduler so that scrapes do not hit the database
    private final AtomicLong pendingEntries = new AtomicLong(0);
    private final AtomicLong awaitingOutcome = new AtomicLong(0);

    public LedgerMetrics(MeterRegistry registry, LedgerStore ledgerStore,
                         TransactionLogService transactionLogService) {
        this.registry = registry;
        this.ledgerStore = ledgerStore;
        this.transactionLogService = transactionLogService;

        this.tokenRefreshes = Counter.builder("gateway.token.refreshes")
                .description("Number of gateway bearer tokens acquired")
                .register(registry);

        this.invalidSignatures = Counter.builder("ledger.webhooks.invalid_signature")
                .description("Webhooks rejected for a bad signature")
                .register(registry);
    }

    @PostConstruct
    public void init() {
        Gauge.builder("ledger.entries.pending", pendingEntries, AtomicLong::get)
                .description("Ledger entries waiting for gateway confirmation")
                .register(registry);

        Gauge.builder("ledger.gateway.awaiting_outcome", awaitingOutcome, AtomicLong::get)
                .description("Gateway calls whose outcome is still unknown")
                .register(registry);
    }

    public void recordOperation(String operation, String outcome, Duration duration) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
        Timer.builder("ledger.operation.duration")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    public void recordDuplicateRequest(String operation) {
        registry.counter("ledger.duplicate_requests", "operation", sanitizeTag(operation)).increment();
    }

    public void recordGatewayCall(String operation, String outcome, Duration duration) {
        registry.counter("gateway.calls",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
        registry.timer("gateway.call.duration", "operation", sanitizeTag(operation)).record(duration);
    }

    public void recordGatewayRetry(String operation) {
        registry.counter("gateway.retries", "operation", sanitizeTag(operation)).increment();
    }

    public void recordTokenRefresh() {
        tokenRefreshes.increment();
    }

    public void recordWebhook(String result) {
        registry.counter("ledger.webhooks", "result", sanitizeTag(result)).increment();
    }

    public void recordInvalidSignature() {
        invalidSignatures.increment();
    }

    public void recordReconciliation(boolean reconciled, int discrepancies) {
        registry.counter("ledger.reconciliation.runs", "reconciled", String.valueOf(reconciled)).increment();
        if (discrepancies > 0) {
            registry.counter("ledger.reconciliation.discrepancies").increment(discrepancies);
        }
    }

    public void recordPendingResolution(String outcome) {
        registry.counter("ledger.pending.resolutions", "outcome", sanitizeTag(outcome)).increment();
    }

    /**
     * Refreshes the backlog gauges. Called periodically by the scheduler.
     */
    public void refreshBacklog() {
        try {
            pendingEntries.set(ledgerStore.countPending());
            awaitingOutcome.set(transactionLogService.countAwaitingOutcome());
            log.debug("Ledger backlog refreshed: pendingEntries={}, awaitingOutcome={}",
                    pendingEntries.get(), awaitingOutcome.get());
        } catch (Exception e) {
            log.warn("Failed to refresh ledger backlog metrics: {}", e.getMessage());
        }
    }

    public long getPendingEntries() {
        return pendingEntries.get();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
