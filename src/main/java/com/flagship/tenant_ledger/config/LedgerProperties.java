package com.flagship.tenant_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Ledger limits and operational constants ({@code ledger.*}).
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    private Limits limits = new Limits();
    private Pending pending = new Pending();
    private Retry retry = new Retry();
    private Reconciliation reconciliation = new Reconciliation();

    @Getter
    @Setter
    public static class Limits {
        private BigDecimal minAmount = new BigDecimal("0.01");
        private BigDecimal maxAmount = new BigDecimal("100000.00");
        private BigDecimal dailyWithdrawalAmount = new BigDecimal("50000.00");
        private int dailyWithdrawalCount = 10;
    }

    @Getter
    @Setter
    public static class Pending {
        /** Age after which a pending entry is escalated to a gateway status query. */
        private Duration maxAge = Duration.ofMinutes(30);
        private long resolverIntervalMs = 60_000;
        private int resolverBatchSize = 50;
    }

    /**
     * Backoff for idempotent gateway calls only.
     */
    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class Reconciliation {
        private BigDecimal tolerance = new BigDecimal("0.01");
        private Duration statementLookback = Duration.ofDays(1);
        private String cron = "0 0 2 * * *";
    }
}
