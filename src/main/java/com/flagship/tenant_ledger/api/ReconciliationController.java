package com.flagship.tenant_ledger.api;

import com.flagship.tenant_ledger.exception.ReconciliationMismatchException;
import com.flagship.tenant_ledger.reconciliation.BalanceSyncResult;
import com.flagship.tenant_ledger.reconciliation.ReconciliationEngine;
import com.flagship.tenant_ledger.reconciliation.ReconciliationReportEntity;
import com.flagship.tenant_ledger.reconciliation.ReconciliationReportService;
import com.flagship.tenant_ledger.reconciliation.ReconciliationReportView;
import com.flagship.tenant_ledger.reconciliation.ReviewDecisionRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Balance sync on demand and the operator review of its reports.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Validated
public class ReconciliationController {

    private final ReconciliationEngine engine;
    private final ReconciliationReportService reportService;

    /**
     * Runs a balance sync on demand. A mismatch is a 200 with {@code reconciled=false}
     * unless {@code strict} is set, in which case it is a 409.
     */
    @PostMapping("/tenants/{tenantId}/reconciliation")
    public ResponseEntity<BalanceSyncResult> reconcile(
            @PathVariable("tenantId") Long tenantId,
            @RequestParam(value = "strict", defaultValue = "false") boolean strict) {
        BalanceSyncResult result = engine.syncBalance(tenantId);
        if (strict && !result.isReconciled()) {
            throw new ReconciliationMismatchException(tenantId, result.getReportId(),
                    result.getInternalBalance(), result.getExternalBalance());
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/tenants/{tenantId}/reconciliation/latest")
    public ResponseEntity<ReconciliationReportView> latest(@PathVariable("tenantId") Long tenantId) {
        return ResponseEntity.of(reportService.findLatest(tenantId).map(ReconciliationReportView::from));
    }

    @GetMapping("/tenants/{tenantId}/reconciliation/reports")
    public ResponseEntity<Page<ReconciliationReportView>> history(
            @PathVariable("tenantId") Long tenantId,
            @RequestParam(value = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(value = "size", defaultValue = "50") @Min(1) @Max(500) int size) {
        return ResponseEntity.ok(reportService.history(tenantId, page, size).map(ReconciliationReportView::from));
    }

    @GetMapping("/tenants/{tenantId}/reconciliation/reports/pending")
    public ResponseEntity<List<ReconciliationReportView>> pendingForTenant(@PathVariable("tenantId") Long tenantId) {
        return ResponseEntity.ok(toViews(reportService.pendingReviews(tenantId)));
    }

    /**
     * Mismatched runs across every tenant that still wait for an operator.
     */
    @GetMapping("/reconciliation/pending-reviews")
    public ResponseEntity<List<ReconciliationReportView>> pendingReviews() {
        return ResponseEntity.ok(toViews(reportService.pendingReviews(null)));
    }

    /**
     * Closes the review of a mismatched run. 409 if it is not pending review.
     */
    @PostMapping("/tenants/{tenantId}/reconciliation/reports/{reportId}/review")
    public ResponseEntity<ReconciliationReportView> closeReview(
            @PathVariable("tenantId") Long tenantId,
            @PathVariable("reportId") UUID reportId,
            @Valid @RequestBody ReviewDecisionRequest request) {
        return ResponseEntity.ok(ReconciliationReportView.from(reportService.closeReview(
                tenantId, reportId, request.getOutcome(), request.getResolvedBy(), request.getNotes())));
    }

    private static List<ReconciliationReportView> toViews(List<ReconciliationReportEntity> reports) {
        return reports.stream().map(ReconciliationReportView::from).toList();
    }
}
