package com.flagship.tenant_ledger.operation;

import com.flagship.tenant_ledger.audit.AuditChannel;
import com.flagship.tenant_ledger.config.LedgerProperties;
import com.flagship.tenant_ledger.exception.DuplicateReferenceException;
import com.flagship.tenant_ledger.exception.GatewayAuthenticationException;
import com.flagship.tenant_ledger.exception.GatewayException;
import com.flagship.tenant_ledger.exception.GatewayRejectedException;
import com.flagship.tenant_ledger.exception.GatewayOutcomeUnknownException;
import com.flagship.tenant_ledger.exception.InsufficientBalanceException;
import com.flagship.tenant_ledger.exception.InvalidWebhookSignatureException;
import com.flagship.tenant_ledger.exception.RateLimitExceededException;
import com.flagship.tenant_ledger.exception.TenantAccountNotFoundException;
import com.flagship.tenant_ledger.exception.WithdrawalLimitExceededException;
import com.flagship.tenant_ledger.gateway.GatewayAdapter;
import com.flagship.tenant_ledger.gateway.GatewayCallExecutor;
import com.flagship.tenant_ledger.gateway.GatewayPaymentResponse;
import com.flagship.tenant_ledger.gateway.GatewayTransactionStatus;
import com.flagship.tenant_ledger.gateway.GatewayWebhookEvent;
import com.flagship.tenant_ledger.gateway.GatewayWithdrawalResponse;
import com.flagship.tenant_ledger.ledger.EntryType;
import com.flagship.tenant_ledger.ledger.LedgerEntry;
import com.flagship.tenant_ledger.ledger.LedgerStore;
import com.flagship.tenant_ledger.observability.CorrelationContext;
import com.flagship.tenant_ledger.observability.LedgerMetrics;
import com.flagship.tenant_ledger.operation.dto.BalanceResponse;
import com.flagship.tenant_ledger.operation.dto.CashInRequest;
import com.flagship.tenant_ledger.operation.dto.CashOutRequest;
import com.flagship.tenant_ledger.tenant.GatewayAccountDirectory;
import com.flagship.tenant_ledger.transactionlog.PayloadDigest;
import com.flagship.tenant_ledger.transactionlog.TransactionLog;
import com.flagship.tenant_ledger.transactionlog.TransactionLogService;
import com.flagship.tenant_ledger.transactionlog.TransactionLogUpdate;
import com.flagship.tenant_ledger.webhook.WebhookInboxService;
import com.flagship.tenant_ledger.webhook.WebhookResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Business entry point for moving money in and out of a tenant's balance.
 *
 * Gateway calls are made here, outside any database transaction. Everything
 * that touches the ledger goes through {@link LedgerPostingService}, one short
 * transaction per step, so a slow gateway never holds a tenant lock.
 *
 * Expected business failures come back as a failed {@link OperationResult};
 * only programming errors and infrastructure faults propagate as exceptions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerStore ledgerStore;
    private final LedgerPostingService postingService;
    private final TransactionLogService transactionLogService;
    private final WebhookInboxService webhookInboxService;
    private final GatewayAdapter gatewayAdapter;
    private final GatewayCallExecutor gatewayCallExecutor;
    private final GatewayAccountDirectory accountDirectory;
    private final WithdrawalRateLimiter rateLimiter;
    private final AuditChannel auditChannel;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;

    // ==================== Cash-in ====================

    /**
     * Creates a PIX charge or boleto at the gateway and records the incoming
     * money as a pending credit. The credit is confirmed by the synchronous
     * response when the gateway already reports it paid, otherwise by a webhook
     * or the pending-entry resolver.
     *
     * Repeating a request with the same reference returns the original result
     * without a second gateway call.
     */
    public OperationResult processCashIn(CashInRequest request) {
        long start = System.nanoTime();
        String previousTenant = MDC.get(CorrelationContext.TENANT_ID_MDC_KEY);
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, String.valueOf(request.getTenantId()));

        log.info("Cash-in requested: referenceId={}, amount={}, method={}",
                request.getReferenceId(), request.getAmount(), request.getMethod());

        OperationResult result = null;
        try {
            Optional<String> invalid = validate(request.getTenantId(), request.getAmount(), request.getReferenceId());
            if (invalid.isPresent()) {
                result = OperationResult.failed(ErrorCode.VALIDATION_ERROR, invalid.get());
                return result;
            }

            String accountId = accountDirectory.resolveExternalAccountId(request.getTenantId());
            CashInStart started = postingService.beginCashIn(request, accountId);

            result = switch (started.getKind()) {
                case DUPLICATE -> duplicateCashIn(started);
                case IN_FLIGHT -> OperationResult.builder()
                        .success(true)
                        .status(OperationStatus.PENDING)
                        .transactionId(started.getLog().getCorrelationId())
                        .duplicate(true)
                        .outcomeUnknown(true)
                        .message("A previous attempt for this reference is still awaiting the gateway")
                        .build();
                case REPLAY -> replayCashIn(started.getLog());
                case NEW -> submitCashIn(started);
            };
            return result;

        } catch (TenantAccountNotFoundException e) {
            log.warn("Cash-in rejected: {}", e.getMessage());
            result = OperationResult.failed(ErrorCode.TENANT_ACCOUNT_NOT_FOUND, e.getMessage());
            return result;
        } finally {
            metrics.recordOperation("cash_in", outcomeTag(result), Duration.ofNanos(System.nanoTime() - start));
            restoreTenant(previousTenant);
        }
    }

    private OperationResult submitCashIn(CashInStart started) {
        TransactionLog attempt = started.getLog();
        String correlationId = attempt.getCorrelationId();

        GatewayPaymentResponse response;
        try {
            response = gatewayCallExecutor.executeOnce("createPayment",
                    () -> gatewayAdapter.createPayment(started.getGatewayRequest()));
        } catch (GatewayOutcomeUnknownException e) {
            recordUnknownOutcome(correlationId, e);
            log.warn("Cash-in outcome unknown: correlationId={}, errorCode={}, httpStatus={}",
                    correlationId, e.getErrorCode(), e.getHttpStatus());
            return OperationResult.builder()
                    .success(true)
                    .status(OperationStatus.PENDING)
                    .transactionId(correlationId)
                    .outcomeUnknown(true)
                    .message("Gateway gave no usable answer; the payment will be settled when its outcome is known")
                    .build();
        } catch (GatewayRejectedException e) {
            recordRejection(correlationId, e);
            return rejected(correlationId, e.getMessage());
        } catch (GatewayException e) {
            recordRejection(correlationId, e);
            return gatewayError(correlationId, e);
        }

        GatewayTransactionStatus reported = response.getStatus();
        TransactionLog merged = transactionLogService.update(correlationId, TransactionLogUpdate.builder()
                .gatewayTransactionId(response.getExternalId())
                .responsePayload(response.getRawResponse())
                .httpStatus(response.getHttpStatus())
                .gatewayStatus(reported.name())
                .successful(!reported.isTerminalFailure())
                .build());
        GatewayTransactionStatus status = effectiveStatus(merged, reported);

        if (status.isTerminalFailure()) {
            log.warn("Gateway refused cash-in: correlationId={}, status={}", correlationId, status);
            return rejected(correlationId, "Gateway reported " + status);
        }

        LedgerEntry entry = postingService.recordCashInEntry(attempt, response.getExternalId(), status,
                Map.of("method", started.getGatewayRequest().getMethod().name()));
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entry.getId().toString());
        try {
            log.info("Cash-in recorded: correlationId={}, externalId={}, status={}",
                    correlationId, response.getExternalId(), entry.getStatus());
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }

        return OperationResult.forEntry(entry, correlationId, "Cash-in created").toBuilder()
                .qrCodeOrBarcode(response.getQrCodeOrBarcode())
                .expiresAt(response.getExpiresAt())
                .build();
    }

    private OperationResult duplicateCashIn(CashInStart started) {
        metrics.recordDuplicateRequest("cash_in");
        LedgerEntry existing = started.getExistingEntry();
        log.info("Duplicate cash-in, returning existing entry: entryId={}, status={}",
                existing.getId(), existing.getStatus());
        String transactionId = started.getLog() != null ? started.getLog().getCorrelationId() : null;
        return OperationResult.forEntry(existing, transactionId, "Cash-in already recorded for this reference")
                .toBuilder()
                .duplicate(true)
                .build();
    }

    /**
     * The gateway accepted an earlier attempt but its entry was never written.
     */
    private OperationResult replayCashIn(TransactionLog attempt) {
        GatewayTransactionStatus status = parseStatus(attempt.getGatewayStatus());
        LedgerEntry entry = postingService.recordCashInEntry(attempt, attempt.getGatewayTransactionId(), status,
                Map.of("source", "replay"));
        return OperationResult.forEntry(entry, attempt.getCorrelationId(), "Cash-in recovered from transaction log")
                .toBuilder()
                .duplicate(true)
                .build();
    }

    // ==================== Cash-out ====================

    /**
     * Pays money out of the tenant's balance. The funds are reserved with a
     * pending debit before the gateway is called; a refusal releases them with
     * a reversal.
     */
    public OperationResult processCashOut(CashOutRequest request) {
        long start = System.nanoTime();
        String previousTenant = MDC.get(CorrelationContext.TENANT_ID_MDC_KEY);
        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, String.valueOf(request.getTenantId()));

        log.info("Cash-out requested: referenceId={}, amount={}", request.getReferenceId(), request.getAmount());

        OperationResult result = null;
        try {
            Optional<String> invalid = validate(request.getTenantId(), request.getAmount(), request.getReferenceId());
            if (invalid.isPresent()) {
                result = OperationResult.failed(ErrorCode.VALIDATION_ERROR, invalid.get());
                return result;
            }
            if (request.getDestination() == null) {
                result = OperationResult.failed(ErrorCode.VALIDATION_ERROR, "Destination bank account is required");
                return result;
            }

            String accountId = accountDirectory.resolveExternalAccountId(request.getTenantId());

            Optional<LedgerEntry> existing = ledgerStore.findActiveByReference(
                    request.getTenantId(), request.getReferenceId(), EntryType.CASH_OUT);
            if (existing.isPresent()) {
                result = duplicateCashOut(existing.get());
                return result;
            }

            WithdrawalRateLimiter.Permit permit = rateLimiter.acquire(request.getTenantId());

            CashOutStart started;
            try {
                started = postingService.beginCashOut(request, accountId);
            } catch (DuplicateReferenceException e) {
                permit.release();
                LedgerEntry original = ledgerStore.findActiveByReference(
                        request.getTenantId(), request.getReferenceId(), EntryType.CASH_OUT)
                        .orElseThrow(() -> e);
                result = duplicateCashOut(original);
                return result;
            } catch (RuntimeException e) {
                // no reservation, so the attempt does not count against the daily allowance
                permit.release();
                throw e;
            }

            result = submitCashOut(started);
            return result;

        } catch (TenantAccountNotFoundException e) {
            log.warn("Cash-out rejected: {}", e.getMessage());
            result = OperationResult.failed(ErrorCode.TENANT_ACCOUNT_NOT_FOUND, e.getMessage());
            return result;
        } catch (RateLimitExceededException e) {
            result = OperationResult.failed(ErrorCode.RATE_LIMITED, e.getMessage());
            return result;
        } catch (InsufficientBalanceException e) {
            log.info("Cash-out rejected: {}", e.getMessage());
            result = OperationResult.failed(ErrorCode.INSUFFICIENT_BALANCE, e.getMessage());
            return result;
        } catch (WithdrawalLimitExceededException e) {
            log.info("Cash-out rejected: {}", e.getMessage());
            result = OperationResult.failed(ErrorCode.WITHDRAWAL_LIMIT_EXCEEDED, e.getMessage());
            return result;
        } finally {
            metrics.recordOperation("cash_out", outcomeTag(result), Duration.ofNanos(System.nanoTime() - start));
            restoreTenant(previousTenant);
        }
    }

    private OperationResult submitCashOut(CashOutStart started) {
        LedgerEntry debit = started.getEntry();
        String correlationId = started.getLog().getCorrelationId();
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, debit.getId().toString());

        try {
            GatewayWithdrawalResponse response;
            try {
                response = gatewayCallExecutor.executeOnce("createWithdrawal",
                        () -> gatewayAdapter.createWithdrawal(started.getGatewayRequest()));
            } catch (GatewayOutcomeUnknownException e) {
                recordUnknownOutcome(correlationId, e);
                log.warn("Cash-out outcome unknown, funds stay reserved: correlationId={}, errorCode={}, httpStatus={}",
                        correlationId, e.getErrorCode(), e.getHttpStatus());
                return OperationResult.builder()
                        .success(true)
                        .status(OperationStatus.PENDING)
                        .transactionId(correlationId)
                        .entryId(debit.getId())
                        .outcomeUnknown(true)
                        .message("Gateway gave no usable answer; funds stay reserved until the outcome is known")
                        .build();
            } catch (GatewayRejectedException e) {
                recordRejection(correlationId, e);
                postingService.releaseReservation(debit, "gateway rejected: " + e.getMessage());
                return rejected(correlationId, e.getMessage()).toBuilder().entryId(debit.getId()).build();
            } catch (GatewayException e) {
                recordRejection(correlationId, e);
                postingService.releaseReservation(debit, "gateway error: " + e.getErrorCode());
                return gatewayError(correlationId, e).toBuilder().entryId(debit.getId()).build();
            }

            GatewayTransactionStatus reported = response.getStatus();
            BigDecimal fee = response.getFee();
            TransactionLog merged = transactionLogService.update(correlationId, TransactionLogUpdate.builder()
                    .gatewayTransactionId(response.getExternalId())
                    .responsePayload(response.getRawResponse())
                    .httpStatus(response.getHttpStatus())
                    .gatewayStatus(reported.name())
                    .fee(fee)
                    .netAmount(LedgerPostingService.netAmount(debit.getAmount(), fee))
                    .successful(!reported.isTerminalFailure())
                    .build());
            GatewayTransactionStatus status = effectiveStatus(merged, reported);

            SettlementOutcome outcome = postingService.settle(debit.getId(), response.getExternalId(), status,
                    "gateway reported " + status);
            log.info("Cash-out submitted: correlationId={}, externalId={}, status={}, outcome={}",
                    correlationId, response.getExternalId(), status, outcome);

            if (status.isTerminalFailure()) {
                return rejected(correlationId, "Gateway reported " + status).toBuilder()
                        .entryId(debit.getId())
                        .externalId(response.getExternalId())
                        .build();
            }

            return OperationResult.builder()
                    .success(true)
                    .status(status.isTerminalSuccess() ? OperationStatus.COMPLETED : OperationStatus.PENDING)
                    .transactionId(correlationId)
                    .entryId(debit.getId())
                    .externalId(response.getExternalId())
                    .fee(fee)
                    .message(status.isTerminalSuccess() ? "Cash-out completed" : "Cash-out submitted")
                    .build();
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    private OperationResult duplicateCashOut(LedgerEntry original) {
        metrics.recordDuplicateRequest("cash_out");
        log.info("Duplicate cash-out, returning existing entry: entryId={}, status={}",
                original.getId(), original.getStatus());
        String transactionId = transactionLogService.findByLedgerEntryId(original.getId())
                .map(TransactionLog::getCorrelationId)
                .orElse(null);
        return OperationResult.forEntry(original, transactionId, "Cash-out already recorded for this reference")
                .toBuilder()
                .duplicate(true)
                .build();
    }

    // ==================== Webhooks ====================

    /**
     * Verifies, records and applies a gateway notification.
     *
     * @throws InvalidWebhookSignatureException if the signature does not match; nothing is applied
     * @throws IllegalArgumentException if the payload is not a recognisable notification
     */
    public WebhookResult handleWebhook(String payload, String signature) {
        String payloadHash = PayloadDigest.sha256Hex(payload);

        if (!gatewayAdapter.verifyWebhookSignature(payload, signature)) {
            UUID inboxId = webhookInboxService.recordRejected(payloadHash, payload, signature, "invalid signature");
            auditChannel.reportInvalidSignature(inboxId, payloadHash, signature != null && !signature.isBlank());
            metrics.recordInvalidSignature();
            metrics.recordWebhook(WebhookResult.REJECTED.name());
            log.warn("Webhook rejected, invalid signature: inboxId={}, payloadHash={}", inboxId, payloadHash);
            throw new InvalidWebhookSignatureException("Webhook signature verification failed");
        }

        GatewayWebhookEvent event;
        try {
            event = gatewayAdapter.parseWebhook(payload);
        } catch (IllegalArgumentException e) {
            webhookInboxService.recordRejected(payloadHash, payload, signature, "malformed payload");
            metrics.recordWebhook(WebhookResult.REJECTED.name());
            log.warn("Webhook rejected, malformed payload: payloadHash={}, error={}", payloadHash, e.getMessage());
            throw e;
        }

        WebhookResult result = postingService.applyWebhook(event, payload, signature);
        metrics.recordWebhook(result.name());
        return result;
    }

    // ==================== Queries ====================

    public BalanceResponse getBalance(Long tenantId) {
        return new BalanceResponse(
                tenantId,
                ledgerStore.getBalance(tenantId),
                ledgerStore.getAvailableBalance(tenantId),
                ledgerStore.getPendingCredits(tenantId));
    }

    public Page<LedgerEntry> listEntries(Long tenantId, int page, int size) {
        return ledgerStore.listEntries(tenantId,
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "sequenceNumber")));
    }

    // ==================== Helpers ====================

    private Optional<String> validate(Long tenantId, BigDecimal amount, String referenceId) {
        LedgerProperties.Limits limits = properties.getLimits();
        if (tenantId == null) {
            return Optional.of("Tenant id is required");
        }
        if (referenceId == null || referenceId.isBlank()) {
            return Optional.of("Reference id is required");
        }
        if (amount == null || amount.compareTo(limits.getMinAmount()) < 0) {
            return Optional.of("Amount must be at least " + limits.getMinAmount());
        }
        if (amount.compareTo(limits.getMaxAmount()) > 0) {
            return Optional.of("Amount must not exceed " + limits.getMaxAmount());
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            return Optional.of("Amount must have at most two decimal places");
        }
        return Optional.empty();
    }

    private void recordUnknownOutcome(String correlationId, GatewayOutcomeUnknownException e) {
        transactionLogService.update(correlationId, TransactionLogUpdate.builder()
                .gatewayStatus(GatewayTransactionStatus.UNKNOWN.name())
                .httpStatus(e.getHttpStatus())
                .errorMessage(e.getMessage())
                .build());
    }

    /**
     * A webhook may have settled the transaction while the synchronous call was
     * in flight. Its terminal status wins over whatever the call reported.
     */
    private static GatewayTransactionStatus effectiveStatus(TransactionLog merged, GatewayTransactionStatus reported) {
        if (merged != null && GatewayTransactionStatus.isTerminalName(merged.getGatewayStatus())) {
            return GatewayTransactionStatus.valueOf(merged.getGatewayStatus());
        }
        return reported;
    }

    private void recordRejection(String correlationId, GatewayException e) {
        String detail = e.getMessage();
        if (e instanceof GatewayRejectedException && ((GatewayRejectedException) e).getResponseBody() != null) {
            detail = detail + ": " + ((GatewayRejectedException) e).getResponseBody();
        }
        transactionLogService.update(correlationId, TransactionLogUpdate.builder()
                .httpStatus(e.getHttpStatus())
                .successful(false)
                .errorMessage(detail)
                .build());
        log.warn("Gateway call failed: correlationId={}, errorCode={}, httpStatus={}",
                correlationId, e.getErrorCode(), e.getHttpStatus());
    }

    private static OperationResult rejected(String correlationId, String message) {
        return OperationResult.failed(ErrorCode.GATEWAY_REJECTED, message).toBuilder()
                .transactionId(correlationId)
                .build();
    }

    private static OperationResult gatewayError(String correlationId, GatewayException e) {
        String message = e instanceof GatewayAuthenticationException
                ? "Gateway authentication failed"
                : "Gateway unavailable";
        return OperationResult.failed(ErrorCode.GATEWAY_ERROR, message).toBuilder()
                .transactionId(correlationId)
                .build();
    }

    static GatewayTransactionStatus parseStatus(String status) {
        if (status == null) {
            return GatewayTransactionStatus.PENDING;
        }
        try {
            return GatewayTransactionStatus.valueOf(status);
        } catch (IllegalArgumentException e) {
            return GatewayTransactionStatus.UNKNOWN;
        }
    }

    private static String outcomeTag(OperationResult result) {
        if (result == null) {
            return "error";
        }
        if (result.getErrorCode() != null) {
            return result.getErrorCode().name().toLowerCase();
        }
        return result.getStatus().name().toLowerCase();
    }

    private static void restoreTenant(String previousTenant) {
        if (previousTenant != null) {
            MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, previousTenant);
        } else {
            MDC.remove(CorrelationContext.TENANT_ID_MDC_KEY);
        }
    }
}
