package com.flagship.tenant_ledger.reconciliation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tenant_ledger.audit.AuditChannel;
import com.flagship.tenant_ledger.exception.InvalidStateTransitionException;
import com.flagship.tenant_ledger.exception.ReconciliationReportNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists reconciliation runs and their operator review. A mismatched run and
 * its audit event are written in the same transaction, and the run stays
 * pending review until an operator resolves or dismisses it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationReportService {

    private final ReconciliationReportRepository repository;
    private final AuditChannel auditChannel;
    private final ObjectMapper objectMapper;

    @Transactional
    public UUID save(Long tenantId, Instant periodStart, Instant periodEnd, BigDecimal internalBalance,
                     BigDecimal externalBalance, boolean reconciled, List<Discrepancy> discrepancies) {
        UUID reportId = UUID.randomUUID();
        ReconciliationReportEntity entity = new ReconciliationReportEntity(
                reportId,
                tenantId,
                periodStart,
                periodEnd,
                internalBalance,
                externalBalance,
                internalBalance.subtract(externalBalance),
                reconciled,
                discrepancies.size(),
                serialize(discrepancies),
                Instant.now(),
                reconciled ? ReviewStatus.NOT_REQUIRED : ReviewStatus.PENDING_REVIEW,
                null,
                null,
                null);
        repository.save(entity);

        if (!reconciled) {
            auditChannel.reportReconciliationMismatch(tenantId, reportId, internalBalance, externalBalance,
                    discrepancies.size());
        }
        log.debug("Reconciliation report saved: reportId={}, tenantId={}, reconciled={}", reportId, tenantId, reconciled);
        return reportId;
    }

    @Transactional(readOnly = true)
    public Optional<ReconciliationReportEntity> findLatest(Long tenantId) {
        return repository.findFirstByTenantIdOrderByCreatedAtDesc(tenantId);
    }

    /**
     * A tenant's runs, newest first.
     */
    @Transactional(readOnly = true)
    public Page<ReconciliationReportEntity> history(Long tenantId, int page, int size) {
        return repository.findByTenantIdOrderByCreatedAtDesc(tenantId, PageRequest.of(page, size));
    }

    /**
     * Mismatched runs nobody has closed yet, newest first. All tenants when {@code tenantId} is null.
     */
    @Transactional(readOnly = true)
    public List<ReconciliationReportEntity> pendingReviews(Long tenantId) {
        return tenantId == null
                ? repository.findByReviewStatusOrderByCreatedAtDesc(ReviewStatus.PENDING_REVIEW)
                : repository.findByTenantIdAndReviewStatusOrderByCreatedAtDesc(tenantId, ReviewStatus.PENDING_REVIEW);
    }

    /**
     * Records an operator's verdict on a mismatched run.
     *
     * @throws ReconciliationReportNotFoundException if the report does not exist for the tenant
     * @throws InvalidStateTransitionException if the report is not pending review
     */
    @Transactional
    public ReconciliationReportEntity closeReview(Long tenantId, UUID reportId, ReviewStatus outcome,
                                                  String operator, String notes) {
        ReconciliationReportEntity report = repository.findById(reportId)
                .filter(candidate -> candidate.getTenantId().equals(tenantId))
                .orElseThrow(() -> new ReconciliationReportNotFoundException(reportId));
        if (!report.closeReview(outcome, operator, notes, Instant.now())) {
            throw new InvalidStateTransitionException(String.format(
                    "Reconciliation report %s cannot move from %s to %s", reportId, report.getReviewStatus(), outcome));
        }
        repository.save(report);
        log.info("Reconciliation review closed: reportId={}, tenantId={}, outcome={}, resolvedBy={}",
                reportId, tenantId, outcome, operator);
        return report;
    }

    private String serialize(List<Discrepancy> discrepancies) {
        try {
            return objectMapper.writeValueAsString(discrepancies);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize discrepancies", e);
        }
    }
}
