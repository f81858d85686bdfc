package com.flagship.tenant_ledger.reconciliation;

import com.flagship.tenant_ledger.observability.CorrelationContext;
import com.flagship.tenant_ledger.tenant.GatewayAccount;
import com.flagship.tenant_ledger.tenant.GatewayAccountDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Nightly balance sync over every active gateway account. A failing tenant is
 * logged and skipped.
 */
@Component
@ConditionalOnProperty(name = "ledger.scheduling.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReconciliationScheduler {

    private final ReconciliationEngine engine;
    private final GatewayAccountDirectory accountDirectory;

    @Scheduled(cron = "${ledger.reconciliation.cron:0 0 2 * * *}", zone = "UTC")
    public void reconcileAll() {
        List<GatewayAccount> accounts = accountDirectory.findActiveAccounts();
        log.info("Starting reconciliation for {} tenants", accounts.size());

        int mismatched = 0;
        int failed = 0;
        for (GatewayAccount account : accounts) {
            MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, String.valueOf(account.getTenantId()));
            try {
                if (!engine.syncBalance(account.getTenantId()).isReconciled()) {
                    mismatched++;
                }
            } catch (Exception e) {
                failed++;
                log.error("Reconciliation failed for tenant {}: {}", account.getTenantId(), e.getMessage(), e);
            } finally {
                MDC.remove(CorrelationContext.TENANT_ID_MDC_KEY);
            }
        }

        log.info("Reconciliation finished: tenants={}, mismatched={}, failed={}", accounts.size(), mismatched, failed);
    }
}
