package com.flagship.tenant_ledger.gateway;

import com.flagship.tenant_ledger.config.LedgerProperties;
import com.flagship.tenant_ledger.exception.GatewayException;
import com.flagship.tenant_ledger.exception.GatewayTimeoutException;
import com.flagship.tenant_ledger.exception.GatewayUnavailableException;
import com.flagship.tenant_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs gateway calls with timing and, for idempotent calls only, bounded
 * exponential backoff on timeouts and unavailability.
 *
 * Each attempt is already bounded by the HTTP client's connect and response
 * timeouts, so a stalled gateway holds a worker for at most
 * {@code maxAttempts * readTimeout + backoff}.
 */
@Component
@Slf4j
public class GatewayCallExecutor {

    private final LedgerMetrics metrics;
    private final RetryTemplate retryTemplate;

    public GatewayCallExecutor(LedgerProperties properties, LedgerMetrics metrics) {
        this.metrics = metrics;
        LedgerProperties.Retry retry = properties.getRetry();
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(retry.getMaxAttempts())
                .exponentialBackoff(retry.getInitialBackoff().toMillis(), retry.getMultiplier(),
                        retry.getMaxBackoff().toMillis())
                .retryOn(List.of(GatewayTimeoutException.class, GatewayUnavailableException.class))
                .build();
    }

    /**
     * For reads the gateway can safely repeat: status, balance, statement.
     */
    public <T> T executeIdempotent(String operation, Supplier<T> call) {
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                metrics.recordGatewayRetry(operation);
                log.warn("Retrying gateway call: operation={}, attempt={}, lastError={}",
                        operation, context.getRetryCount() + 1,
                        context.getLastThrowable() != null ? context.getLastThrowable().getMessage() : null);
            }
            return timed(operation, call);
        });
    }

    /**
     * For calls that move money. Never retried here: the caller must consult the
     * transaction log before issuing the call again.
     */
    public <T> T executeOnce(String operation, Supplier<T> call) {
        return timed(operation, call);
    }

    private <T> T timed(String operation, Supplier<T> call) {
        long start = System.nanoTime();
        try {
            T result = call.get();
            metrics.recordGatewayCall(operation, "success", Duration.ofNanos(System.nanoTime() - start));
            return result;
        } catch (GatewayException e) {
            metrics.recordGatewayCall(operation, e.getErrorCode(), Duration.ofNanos(System.nanoTime() - start));
            throw e;
        }
    }
}
