package com.flagship.tenant_ledger.operation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tenant_ledger.audit.AuditChannel;
import com.flagship.tenant_ledger.audit.event.PendingEscalationEvent;
import com.flagship.tenant_ledger.config.LedgerProperties;
import com.flagship.tenant_ledger.exception.DuplicateReferenceException;
import com.flagship.tenant_ledger.exception.EntryNotFoundException;
import com.flagship.tenant_ledger.gateway.BankAccountDetails;
import com.flagship.tenant_ledger.gateway.GatewayPaymentRequest;
import com.flagship.tenant_ledger.gateway.GatewayTransactionStatus;
import com.flagship.tenant_ledger.gateway.GatewayWebhookEvent;
import com.flagship.tenant_ledger.gateway.GatewayWithdrawalRequest;
import com.flagship.tenant_ledger.gateway.PayerDetails;
import com.flagship.tenant_ledger.ledger.EntryType;
import com.flagship.tenant_ledger.ledger.LedgerEntry;
import com.flagship.tenant_ledger.ledger.LedgerStore;
import com.flagship.tenant_ledger.operation.dto.CashInRequest;
import com.flagship.tenant_ledger.operation.dto.CashOutRequest;
import com.flagship.tenant_ledger.transactionlog.OperationType;
import com.flagship.tenant_ledger.transactionlog.PayloadDigest;
import com.flagship.tenant_ledger.transactionlog.TransactionLog;
import com.flagship.tenant_ledger.transactionlog.TransactionLogService;
import com.flagship.tenant_ledger.transactionlog.TransactionLogUpdate;
import com.flagship.tenant_ledger.webhook.WebhookInboxService;
import com.flagship.tenant_ledger.webhook.WebhookResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The transactional steps of cash-in, cash-out and webhook handling.
 *
 * Each public method is one database transaction that starts by taking the
 * tenant's advisory lock, so the synchronous gateway response, a racing
 * webhook and the pending-entry resolver never interleave on the same tenant.
 * Gateway calls happen outside these transactions, in {@link LedgerService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerPostingService {

    private final LedgerStore ledgerStore;
    private final TransactionLogService transactionLogService;
    private final WebhookInboxService webhookInboxService;
    private final AuditChannel auditChannel;
    private final LedgerProperties properties;
    private final ObjectMapper objectMapper;

    // ==================== Cash-in ====================

    /**
     * Decides whether a cash-in may call the gateway, and writes the log row if so.
     * The log row always exists before the call leaves the process.
     */
    @Transactional
    public CashInStart beginCashIn(CashInRequest request, String accountId) {
        Long tenantId = request.getTenantId();
        ledgerStore.lockTenant(tenantId);

        Optional<TransactionLog> latest = transactionLogService
                .findLatestAttempt(tenantId, OperationType.PAYMENT, request.getReferenceId());

        Optional<LedgerEntry> active = ledgerStore
                .findActiveByReference(tenantId, request.getReferenceId(), EntryType.CASH_IN);
        if (active.isPresent()) {
            return CashInStart.duplicate(active.get(), latest.orElse(null));
        }

        if (latest.isPresent()) {
            TransactionLog previous = latest.get();
            if (previous.hasGatewayTransaction() && previous.getLedgerEntryId() == null
                    && !Boolean.FALSE.equals(previous.getSuccessful())) {
                log.warn("Replaying cash-in from transaction log: correlationId={}, gatewayTransactionId={}",
                        previous.getCorrelationId(), previous.getGatewayTransactionId());
                return CashInStart.replay(previous);
            }
            if (previous.isAwaitingOutcome() && !previous.hasGatewayTransaction()) {
                log.info("Cash-in attempt still awaiting outcome: correlationId={}, referenceId={}",
                        previous.getCorrelationId(), request.getReferenceId());
                return CashInStart.inFlight(previous);
            }
        }

        TransactionLog attempt = TransactionLog.start(
                tenantId, OperationType.PAYMENT, request.getReferenceId(), request.getAmount(), null);
        GatewayPaymentRequest gatewayRequest = GatewayPaymentRequest.builder()
                .accountId(accountId)
                .correlationId(attempt.getCorrelationId())
                .method(request.getMethod())
                .amount(request.getAmount())
                .description(request.getDescription())
                .payer(request.getPayer() == null ? null : PayerDetails.builder()
                        .name(request.getPayer().getName())
                        .document(request.getPayer().getDocument())
                        .email(request.getPayer().getEmail())
                        .build())
                .dueDate(request.getDueDate())
                .build();

        transactionLogService.record(attempt.toBuilder().requestPayload(toJson(gatewayRequest)).build());
        return CashInStart.fresh(attempt, gatewayRequest);
    }

    /**
     * Writes the pending CASH_IN entry for a payment the gateway accepted and
     * applies the status it reported. Returns the existing entry if a webhook
     * got there first.
     */
    @Transactional
    public LedgerEntry recordCashInEntry(TransactionLog attempt, String externalId,
                                         GatewayTransactionStatus status, Map<String, Object> metadata) {
        ledgerStore.lockTenant(attempt.getTenantId());

        if (externalId != null) {
            Optional<LedgerEntry> existing = ledgerStore.findByExternalTransactionId(externalId);
            if (existing.isPresent()) {
                transactionLogService.update(attempt.getCorrelationId(),
                        TransactionLogUpdate.builder().ledgerEntryId(existing.get().getId()).build());
                return existing.get();
            }
        }

        Map<String, Object> entryMetadata = new HashMap<>(metadata == null ? Map.of() : metadata);
        entryMetadata.put("correlationId", attempt.getCorrelationId());

        LedgerEntry entry = LedgerEntry.pending(attempt.getTenantId(), EntryType.CASH_IN, attempt.getAmount(),
                attempt.getReferenceId(), externalId, "Cash-in " + attempt.getReferenceId(), entryMetadata);
        ledgerStore.append(entry);
        transactionLogService.update(attempt.getCorrelationId(),
                TransactionLogUpdate.builder().ledgerEntryId(entry.getId()).build());

        if (status != null && status.isTerminal()) {
            settle(entry.getId(), externalId, status, "gateway reported " + status);
        }
        return ledgerStore.findById(entry.getId()).orElseThrow(() -> new EntryNotFoundException(entry.getId()));
    }

    // ==================== Cash-out ====================

    /**
     * Reserves the funds with a pending debit and writes the log row, atomically.
     *
     * @throws com.flagship.tenant_ledger.exception.InsufficientBalanceException if the available balance is short
     * @throws com.flagship.tenant_ledger.exception.WithdrawalLimitExceededException if the daily amount is exceeded
     * @throws DuplicateReferenceException if the reference already has an active withdrawal
     */
    @Transactional
    public CashOutStart beginCashOut(CashOutRequest request, String accountId) {
        Map<String, Object> metadata = new HashMap<>(request.getMetadata() == null ? Map.of() : request.getMetadata());
        TransactionLog attempt = TransactionLog.start(
                request.getTenantId(), OperationType.WITHDRAWAL, request.getReferenceId(), request.getAmount(), null);
        metadata.put("correlationId", attempt.getCorrelationId());

        LedgerEntry debit = LedgerEntry.pending(request.getTenantId(), EntryType.CASH_OUT, request.getAmount(),
                request.getReferenceId(), null,
                request.getDescription() != null ? request.getDescription() : "Cash-out " + request.getReferenceId(),
                metadata);
        ledgerStore.appendDebitIfCovered(debit, properties.getLimits().getDailyWithdrawalAmount());

        CashOutRequest.Destination destination = request.getDestination();
        GatewayWithdrawalRequest gatewayRequest = GatewayWithdrawalRequest.builder()
                .accountId(accountId)
                .correlationId(attempt.getCorrelationId())
                .amount(request.getAmount())
                .description(request.getDescription())
                .destination(BankAccountDetails.builder()
                        .bankCode(destination.getBankCode())
                        .branch(destination.getBranch())
                        .accountNumber(destination.getAccountNumber())
                        .accountType(destination.getAccountType())
                        .holderName(destination.getHolderName())
                        .holderDocument(destination.getHolderDocument())
                        .build())
                .build();

        TransactionLog recorded = attempt.toBuilder()
                .ledgerEntryId(debit.getId())
                .requestPayload(toJson(gatewayRequest))
                .build();
        transactionLogService.record(recorded);
        return new CashOutStart(debit, recorded, gatewayRequest);
    }

    // ==================== Settlement ====================

    /**
     * Applies a gateway status to an entry. Safe to call repeatedly and from
     * any path: the synchronous response, a webhook or the resolver.
     *
     * A withdrawal fee is part of the withdrawn amount: the gateway pays out
     * amount minus fee, so the ledger books only the single debit.
     */
    @Transactional
    public SettlementOutcome settle(UUID entryId, String externalId, GatewayTransactionStatus status,
                                    String reason) {
        LedgerEntry snapshot = ledgerStore.findById(entryId).orElseThrow(() -> new EntryNotFoundException(entryId));
        ledgerStore.lockTenant(snapshot.getTenantId());
        LedgerEntry entry = ledgerStore.findById(entryId).orElseThrow(() -> new EntryNotFoundException(entryId));

        if (status.isTerminalSuccess()) {
            if (entry.isPending()) {
                ledgerStore.confirmIfPending(entryId, externalId);
                return SettlementOutcome.CONFIRMED;
            }
            if (entry.isConfirmed()) {
                return SettlementOutcome.ALREADY_SETTLED;
            }
            auditChannel.reportContradictoryOutcome(entry, externalId, status.name());
            return SettlementOutcome.CONTRADICTORY;
        }

        if (status.isTerminalFailure()) {
            if (entry.isPending()) {
                if (status == GatewayTransactionStatus.EXPIRED && entry.getType() == EntryType.CASH_IN) {
                    ledgerStore.markFailed(entryId, reason);
                    return SettlementOutcome.FAILED;
                }
                ledgerStore.reverseIfPending(entryId, reason);
                return SettlementOutcome.REVERSED;
            }
            if (entry.isConfirmed()) {
                auditChannel.reportContradictoryOutcome(entry, externalId, status.name());
                return SettlementOutcome.CONTRADICTORY;
            }
            return SettlementOutcome.ALREADY_SETTLED;
        }

        if (entry.isPending() && externalId != null && entry.getExternalTransactionId() == null) {
            ledgerStore.assignExternalTransactionId(entryId, externalId);
        }
        return SettlementOutcome.STILL_PENDING;
    }

    /**
     * Releases the funds of a withdrawal the gateway refused. Empty if the
     * entry had already been settled by another path.
     */
    @Transactional
    public Optional<LedgerEntry> releaseReservation(LedgerEntry debit, String reason) {
        ledgerStore.lockTenant(debit.getTenantId());
        return ledgerStore.reverseIfPending(debit.getId(), reason);
    }

    // ==================== Webhooks ====================

    /**
     * Matches a verified webhook to its transaction and moves the ledger accordingly.
     *
     * Lookup is by gateway transaction id, then by correlation id. Redelivered
     * payloads return the earlier result without touching anything.
     */
    @Transactional
    public WebhookResult applyWebhook(GatewayWebhookEvent event, String payload, String signature) {
        String payloadHash = PayloadDigest.sha256Hex(payload);
        Optional<TransactionLog> match = findTransaction(event);

        if (match.isEmpty()) {
            Optional<WebhookResult> previous = webhookInboxService.registerRedelivery(payloadHash);
            if (previous.isPresent()) {
                return previous.get();
            }
            return recordOrphan(event, payload, signature, payloadHash);
        }

        TransactionLog transaction = match.get();
        ledgerStore.lockTenant(transaction.getTenantId());

        Optional<WebhookResult> previous = webhookInboxService.registerRedelivery(payloadHash);
        if (previous.isPresent()) {
            return previous.get();
        }

        GatewayTransactionStatus status = event.getStatus();
        transactionLogService.update(transaction.getCorrelationId(), TransactionLogUpdate.builder()
                .gatewayTransactionId(event.getGatewayTransactionId())
                .webhookPayload(payload)
                .webhookTimestamp(event.getOccurredAt())
                .gatewayStatus(status.name())
                .fee(event.getFee())
                .netAmount(netAmount(transaction.getAmount(), event.getFee()))
                .successful(status.isTerminalSuccess() ? Boolean.TRUE
                        : status.isTerminalFailure() ? Boolean.FALSE : null)
                .build());

        WebhookResult result;
        String detail;
        if (transaction.getLedgerEntryId() != null) {
            SettlementOutcome outcome = settle(transaction.getLedgerEntryId(), event.getGatewayTransactionId(),
                    status, "gateway webhook: " + status);
            result = toWebhookResult(outcome);
            detail = "entry " + transaction.getLedgerEntryId() + " " + outcome;
        } else if (transaction.getOperationType() == OperationType.PAYMENT) {
            detail = applyToUnbookedCashIn(transaction, event);
            result = detail.startsWith("created") ? WebhookResult.APPLIED : WebhookResult.IGNORED;
        } else {
            result = WebhookResult.IGNORED;
            detail = "withdrawal log without ledger entry";
        }

        webhookInboxService.recordAccepted(payloadHash, payload, signature, event, result, detail);
        log.info("Webhook applied: correlationId={}, gatewayTransactionId={}, status={}, result={}, detail={}",
                transaction.getCorrelationId(), event.getGatewayTransactionId(), status, result, detail);
        return result;
    }

    /**
     * A cash-in whose entry was never written: the synchronous call timed out,
     * or the entry write failed after the gateway accepted it.
     */
    private String applyToUnbookedCashIn(TransactionLog transaction, GatewayWebhookEvent event) {
        GatewayTransactionStatus status = event.getStatus();
        if (status.isTerminalFailure() || status == GatewayTransactionStatus.UNKNOWN) {
            return "no entry to settle for status " + status;
        }

        Optional<LedgerEntry> active = ledgerStore.findActiveByReference(
                transaction.getTenantId(), transaction.getReferenceId(), EntryType.CASH_IN);
        if (active.isPresent() && !sameExternalId(active.get(), event.getGatewayTransactionId())) {
            auditChannel.reportContradictoryOutcome(active.get(), event.getGatewayTransactionId(), status.name());
            return "reference already booked by entry " + active.get().getId();
        }

        LedgerEntry entry = recordCashInEntry(transaction, event.getGatewayTransactionId(), status,
                Map.of("source", "webhook"));
        return "created entry " + entry.getId() + " " + entry.getStatus();
    }

    private WebhookResult recordOrphan(GatewayWebhookEvent event, String payload, String signature,
                                       String payloadHash) {
        UUID inboxId = webhookInboxService.recordAccepted(payloadHash, payload, signature, event,
                WebhookResult.ORPHANED, "no matching transaction");

        Instant now = Instant.now();
        transactionLogService.record(TransactionLog.builder()
                .id(UUID.randomUUID())
                .correlationId(TransactionLog.newCorrelationId(OperationType.WEBHOOK))
                .operationType(OperationType.WEBHOOK)
                .gatewayTransactionId(event.getGatewayTransactionId())
                .amount(event.getAmount())
                .webhookPayload(payload)
                .webhookPayloadHash(payloadHash)
                .webhookReceived(true)
                .webhookTimestamp(event.getOccurredAt() != null ? event.getOccurredAt() : now)
                .gatewayStatus(event.getStatus().name())
                .errorMessage("Orphan webhook, correlationId=" + event.getCorrelationId())
                .createdAt(now)
                .updatedAt(now)
                .build());

        auditChannel.reportOrphanWebhook(inboxId, event);
        return WebhookResult.ORPHANED;
    }

    private Optional<TransactionLog> findTransaction(GatewayWebhookEvent event) {
        if (event.getGatewayTransactionId() != null) {
            Optional<TransactionLog> byGatewayId = transactionLogService.findByGatewayId(event.getGatewayTransactionId());
            if (byGatewayId.isPresent()) {
                return byGatewayId;
            }
        }
        if (event.getCorrelationId() != null) {
            return transactionLogService.find(event.getCorrelationId())
                    .filter(candidate -> candidate.getOperationType() == OperationType.PAYMENT
                            || candidate.getOperationType() == OperationType.WITHDRAWAL);
        }
        return Optional.empty();
    }

    // ==================== Escalation ====================

    /**
     * Gives up waiting on a call whose outcome never became known and hands it to operators.
     */
    @Transactional
    public void escalateUnknownOutcome(TransactionLog attempt, String reason) {
        transactionLogService.update(attempt.getCorrelationId(), TransactionLogUpdate.builder()
                .gatewayStatus("UNRESOLVED")
                .successful(false)
                .errorMessage(reason)
                .build());
        auditChannel.reportPendingEscalation(PendingEscalationEvent.builder()
                .eventId(UUID.randomUUID())
                .tenantId(attempt.getTenantId())
                .entryId(attempt.getLedgerEntryId())
                .correlationId(attempt.getCorrelationId())
                .referenceId(attempt.getReferenceId())
                .externalTransactionId(attempt.getGatewayTransactionId())
                .amount(attempt.getAmount())
                .gatewayStatus(attempt.getGatewayStatus())
                .ageSeconds(Duration.between(attempt.getCreatedAt(), Instant.now()).getSeconds())
                .reason(reason)
                .occurredAt(Instant.now())
                .build());
    }

    private static WebhookResult toWebhookResult(SettlementOutcome outcome) {
        return switch (outcome) {
            case CONFIRMED, FAILED, REVERSED, ALREADY_SETTLED -> WebhookResult.APPLIED;
            case STILL_PENDING, CONTRADICTORY -> WebhookResult.IGNORED;
        };
    }

    /** What actually moved at the gateway: the amount less its fee, for either direction. */
    static BigDecimal netAmount(BigDecimal amount, BigDecimal fee) {
        if (fee == null || amount == null) {
            return null;
        }
        return amount.subtract(fee);
    }

    private static boolean sameExternalId(LedgerEntry entry, String externalId) {
        return externalId != null && externalId.equals(entry.getExternalTransactionId());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize gateway request", e);
        }
    }
}
