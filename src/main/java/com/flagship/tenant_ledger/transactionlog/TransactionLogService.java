package com.flagship.tenant_ledger.transactionlog;

import com.flagship.tenant_ledger.exception.TransactionLogNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Idempotent audit trail of every gateway interaction.
 *
 * Rows are never deleted. Updates are partial merges applied under a row lock,
 * so the synchronous response and a racing webhook cannot overwrite each other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionLogService {

    /** Operation types that own a gateway transaction id. */
    static final Set<OperationType> MONEY_MOVEMENTS = EnumSet.of(OperationType.PAYMENT, OperationType.WITHDRAWAL);

    private final TransactionLogRepository repository;

    /**
     * Inserts a new log row, joining the caller's transaction when there is one.
     */
    @Transactional
    public UUID record(TransactionLog transactionLog) {
        TransactionLogEntity saved = repository.save(TransactionLogEntity.fromDomain(transactionLog));
        log.debug("Transaction log recorded: correlationId={}, operationType={}, tenantId={}",
                saved.getCorrelationId(), saved.getOperationType(), saved.getTenantId());
        return saved.getId();
    }

    /**
     * Merges a partial update into the row with the given correlation id.
     */
    @Transactional
    public TransactionLog update(String correlationId, TransactionLogUpdate update) {
        TransactionLogEntity entity = repository.findForUpdateByCorrelationId(correlationId)
                .orElseThrow(() -> new TransactionLogNotFoundException(correlationId));
        return applyMerge(entity, update);
    }

    /**
     * Merges a partial update into the payment or withdrawal row bound to a gateway transaction id.
     */
    @Transactional
    public TransactionLog updateByGatewayId(String gatewayTransactionId, TransactionLogUpdate update) {
        TransactionLogEntity entity = repository
                .findForUpdateByGatewayTransactionId(gatewayTransactionId, MONEY_MOVEMENTS)
                .orElseThrow(() -> new TransactionLogNotFoundException(gatewayTransactionId));
        return applyMerge(entity, update);
    }

    @Transactional(readOnly = true)
    public Optional<TransactionLog> find(String correlationId) {
        return repository.findByCorrelationId(correlationId).map(TransactionLogEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<TransactionLog> findByGatewayId(String gatewayTransactionId) {
        return repository.findFirstByGatewayTransactionIdAndOperationTypeIn(gatewayTransactionId, MONEY_MOVEMENTS)
                .map(TransactionLogEntity::toDomain);
    }

    /**
     * The payment or withdrawal call that produced a ledger entry.
     */
    @Transactional(readOnly = true)
    public Optional<TransactionLog> findByLedgerEntryId(UUID ledgerEntryId) {
        return repository.findFirstByLedgerEntryIdAndOperationTypeIn(ledgerEntryId, MONEY_MOVEMENTS)
                .map(TransactionLogEntity::toDomain);
    }

    /**
     * The most recent attempt for a business reference, used to avoid re-issuing
     * a non-idempotent gateway call.
     */
    @Transactional(readOnly = true)
    public Optional<TransactionLog> findLatestAttempt(Long tenantId, OperationType operationType, String referenceId) {
        return repository
                .findFirstByTenantIdAndOperationTypeAndReferenceIdOrderByCreatedAtDesc(tenantId, operationType, referenceId)
                .map(TransactionLogEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public long countSince(Long tenantId, OperationType operationType, Instant since) {
        return repository.countByTenantIdAndOperationTypeAndCreatedAtGreaterThanEqual(tenantId, operationType, since);
    }

    @Transactional(readOnly = true)
    public List<TransactionLog> findAwaitingOutcomeBefore(Instant cutoff, int limit) {
        return repository.findAwaitingOutcomeBefore(MONEY_MOVEMENTS, cutoff, PageRequest.of(0, limit))
                .stream()
                .map(TransactionLogEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countAwaitingOutcome() {
        return repository.countAwaitingOutcome(MONEY_MOVEMENTS);
    }

    private TransactionLog applyMerge(TransactionLogEntity entity, TransactionLogUpdate update) {
        boolean changed = entity.merge(update, Instant.now());
        if (changed) {
            log.debug("Transaction log merged: correlationId={}, gatewayStatus={}, successful={}",
                    entity.getCorrelationId(), entity.getGatewayStatus(), entity.getSuccessful());
        } else {
            log.debug("Transaction log unchanged: correlationId={}", entity.getCorrelationId());
        }
        return entity.toDomain();
    }
}
