package com.flagship.tenant_ledger.health;

import com.flagship.tenant_ledger.gateway.GatewayTokenCache;
import com.flagship.tenant_ledger.observability.LedgerMetrics;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness/readiness probe.
 *
 * Only the database decides UP or DOWN; the pending backlog and gateway token
 * state are informational.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final LedgerMetrics ledgerMetrics;
    private final GatewayTokenCache tokenCache;

    public HealthController(DataSource dataSource, LedgerMetrics ledgerMetrics, GatewayTokenCache tokenCache) {
        this.dataSource = dataSource;
        this.ledgerMetrics = ledgerMetrics;
        this.tokenCache = tokenCache;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("pendingEntries", ledgerMetrics.getPendingEntries());
        response.put("gatewayToken", tokenCache.currentExpiry()
                .map(expiry -> expiry.isAfter(Instant.now()) ? "VALID" : "EXPIRED")
                .orElse("NONE"));

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
