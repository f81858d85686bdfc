package com.flagship.tenant_ledger.reconciliation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A stored reconciliation run as shown to operators.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReconciliationReportView {
    @JsonProperty("report_id")
    UUID reportId;
    @JsonProperty("tenant_id")
    Long tenantId;
    @JsonProperty("period_start")
    Instant periodStart;
    @JsonProperty("period_end")
    Instant periodEnd;
    @JsonProperty("internal_balance")
    BigDecimal internalBalance;
    @JsonProperty("external_balance")
    BigDecimal externalBalance;
    @JsonProperty("difference")
    BigDecimal difference;
    @JsonProperty("reconciled")
    boolean reconciled;
    @JsonProperty("discrepancy_count")
    int discrepancyCount;
    /** Stored as JSON, passed through unchanged. */
    @JsonRawValue
    @JsonProperty("discrepancies")
    String discrepancies;
    @JsonProperty("review_status")
    ReviewStatus reviewStatus;
    @JsonProperty("resolved_by")
    String resolvedBy;
    @JsonProperty("resolution_notes")
    String resolutionNotes;
    @JsonProperty("resolved_at")
    Instant resolvedAt;
    @JsonProperty("created_at")
    Instant createdAt;

    public static ReconciliationReportView from(ReconciliationReportEntity report) {
        return ReconciliationReportView.builder()
                .reportId(report.getId())
                .tenantId(report.getTenantId())
                .periodStart(report.getPeriodStart())
                .periodEnd(report.getPeriodEnd())
                .internalBalance(report.getInternalBalance())
                .externalBalance(report.getExternalBalance())
                .difference(report.getDifference())
                .reconciled(report.isReconciled())
                .discrepancyCount(report.getDiscrepancyCount())
                .discrepancies(report.getDiscrepancies())
                .reviewStatus(report.getReviewStatus())
                .resolvedBy(report.getResolvedBy())
                .resolutionNotes(report.getResolutionNotes())
                .resolvedAt(report.getResolvedAt())
                .createdAt(report.getCreatedAt())
                .build();
    }
}
