package com.flagship.tenant_ledger.gateway;

import com.flagship.tenant_ledger.exception.GatewayAuthenticationException;
import com.flagship.tenant_ledger.exception.GatewayOutcomeUnknownException;
import com.flagship.tenant_ledger.exception.GatewayRejectedException;
import com.flagship.tenant_ledger.exception.GatewayTimeoutException;
import com.flagship.tenant_ledger.exception.GatewayUnavailableException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Narrow client for an external settlement provider.
 *
 * Implementations own token acquisition, request shapes and the status vocabulary;
 * nothing provider-specific leaks past this interface.
 *
 * Every call may throw {@link GatewayAuthenticationException} (after one
 * transparent re-authentication), {@link GatewayTimeoutException} (outcome unknown),
 * {@link GatewayRejectedException} (4xx) or {@link GatewayUnavailableException}.
 * The money-moving calls raise {@link GatewayOutcomeUnknownException} instead of
 * {@link GatewayUnavailableException} whenever the request may have been executed.
 * {@link #createPayment} and {@link #createWithdrawal} are not idempotent and are
 * never retried by the adapter.
 */
public interface GatewayAdapter {

    /**
     * Acquires a fresh bearer token, replacing any cached one.
     */
    void authenticate();

    GatewayPaymentResponse createPayment(GatewayPaymentRequest request);

    GatewayWithdrawalResponse createWithdrawal(GatewayWithdrawalRequest request);

    GatewayTransactionStatus getStatus(String externalId);

    BigDecimal getBalance(String accountId);

    List<GatewayStatementItem> getStatement(String accountId, Instant from, Instant to);

    boolean verifyWebhookSignature(String payload, String signature);

    /**
     * @throws IllegalArgumentException if the payload is not a recognisable notification
     */
    GatewayWebhookEvent parseWebhook(String payload);
}
