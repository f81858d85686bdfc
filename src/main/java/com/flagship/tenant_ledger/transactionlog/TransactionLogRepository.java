package com.flagship.tenant_ledger.transactionlog;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransactionLogRepository extends JpaRepository<TransactionLogEntity, UUID> {

    Optional<TransactionLogEntity> findByCorrelationId(String correlationId);

    /**
     * Locks the row so that concurrent merges (synchronous response and webhook) serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM TransactionLogEntity l WHERE l.correlationId = :correlationId")
    Optional<TransactionLogEntity> findForUpdateByCorrelationId(@Param("correlationId") String correlationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT l FROM TransactionLogEntity l
        WHERE l.gatewayTransactionId = :gatewayTransactionId
          AND l.operationType IN :operationTypes
        """)
    Optional<TransactionLogEntity> findForUpdateByGatewayTransactionId(
        @Param("gatewayTransactionId") String gatewayTransactionId,
        @Param("operationTypes") Collection<OperationType> operationTypes);

    Optional<TransactionLogEntity> findFirstByGatewayTransactionIdAndOperationTypeIn(
        String gatewayTransactionId, Collection<OperationType> operationTypes);

    Optional<TransactionLogEntity> findFirstByLedgerEntryIdAndOperationTypeIn(
        UUID ledgerEntryId, Collection<OperationType> operationTypes);

    Optional<TransactionLogEntity> findFirstByTenantIdAndOperationTypeAndReferenceIdOrderByCreatedAtDesc(
        Long tenantId, OperationType operationType, String referenceId);

    long countByTenantIdAndOperationTypeAndCreatedAtGreaterThanEqual(
        Long tenantId, OperationType operationType, Instant since);

    /**
     * Outbound calls whose outcome never became known, oldest first.
     */
    @Query("""
        SELECT l FROM TransactionLogEntity l
        WHERE l.successful IS NULL
          AND l.operationType IN :operationTypes
          AND l.createdAt < :cutoff
        ORDER BY l.createdAt ASC
        """)
    List<TransactionLogEntity> findAwaitingOutcomeBefore(
        @Param("operationTypes") Collection<OperationType> operationTypes,
        @Param("cutoff") Instant cutoff,
        Pageable pageable);

    @Query("SELECT COUNT(l) FROM TransactionLogEntity l WHERE l.successful IS NULL AND l.operationType IN :operationTypes")
    long countAwaitingOutcome(@Param("operationTypes") Collection<OperationType> operationTypes);
}
