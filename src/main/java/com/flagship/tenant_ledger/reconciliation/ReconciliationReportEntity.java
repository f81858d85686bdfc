package com.flagship.tenant_ledger.reconciliation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One reconciliation run. The figures are written once; only the review
 * columns change afterwards, when an operator closes a mismatched report.
 */
@Entity
@Table(name = "reconciliation_reports")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationReportEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private Long tenantId;

    @Column(name = "period_start", nullable = false, updatable = false)
    private Instant periodStart;

    @Column(name = "period_end", nullable = false, updatable = false)
    private Instant periodEnd;

    @Column(name = "internal_balance", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal internalBalance;

    @Column(name = "external_balance", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal externalBalance;

    @Column(name = "difference", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal difference;

    @Column(name = "reconciled", nullable = false, updatable = false)
    private boolean reconciled;

    @Column(name = "discrepancy_count", nullable = false, updatable = false)
    private int discrepancyCount;

    @Column(name = "discrepancies", columnDefinition = "jsonb", nullable = false, updatable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String discrepancies;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "review_status", nullable = false, length = 20)
    private ReviewStatus reviewStatus;

    @Column(name = "resolved_by", length = 100)
    private String resolvedBy;

    @Column(name = "resolution_notes", columnDefinition = "text")
    private String resolutionNotes;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    /**
     * Closes the review. Only a report still pending review can be closed.
     *
     * @return false if the report was not pending review
     */
    public boolean closeReview(ReviewStatus outcome, String operator, String notes, Instant now) {
        if (reviewStatus != ReviewStatus.PENDING_REVIEW || !outcome.isClosing()) {
            return false;
        }
        reviewStatus = outcome;
        resolvedBy = operator;
        resolutionNotes = notes;
        resolvedAt = now;
        return true;
    }
}
