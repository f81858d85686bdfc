package com.flagship.tenant_ledger.api;

import com.flagship.tenant_ledger.ledger.LedgerEntry;
import com.flagship.tenant_ledger.operation.LedgerService;
import com.flagship.tenant_ledger.operation.OperationResult;
import com.flagship.tenant_ledger.operation.OperationStatus;
import com.flagship.tenant_ledger.operation.dto.BalanceResponse;
import com.flagship.tenant_ledger.operation.dto.CashInRequest;
import com.flagship.tenant_ledger.operation.dto.CashOutRequest;
import com.flagship.tenant_ledger.operation.dto.LedgerEntryResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tenant-scoped money movements and balance queries.
 *
 * A request repeated with the same {@code reference_id} returns the original
 * outcome, so clients may retry freely.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}")
@RequiredArgsConstructor
@Validated
@Slf4j
public class LedgerController {

    private final LedgerService ledgerService;

    @PostMapping("/cash-in")
    public ResponseEntity<OperationResult> cashIn(@PathVariable("tenantId") Long tenantId,
                                                  @Valid @RequestBody CashInRequest request) {
        OperationResult result = ledgerService.processCashIn(request.withTenantId(tenantId));
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    @PostMapping("/cash-out")
    public ResponseEntity<OperationResult> cashOut(@PathVariable("tenantId") Long tenantId,
                                                   @Valid @RequestBody CashOutRequest request) {
        OperationResult result = ledgerService.processCashOut(request.withTenantId(tenantId));
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    @GetMapping("/balance")
    public ResponseEntity<BalanceResponse> balance(@PathVariable("tenantId") Long tenantId) {
        return ResponseEntity.ok(ledgerService.getBalance(tenantId));
    }

    @GetMapping("/entries")
    public ResponseEntity<Page<LedgerEntryResponse>> entries(
            @PathVariable("tenantId") Long tenantId,
            @RequestParam(value = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(value = "size", defaultValue = "50") @Min(1) @Max(500) int size) {
        Page<LedgerEntry> entries = ledgerService.listEntries(tenantId, page, size);
        return ResponseEntity.ok(entries.map(LedgerEntryResponse::from));
    }

    static HttpStatus statusFor(OperationResult result) {
        if (result.getErrorCode() != null) {
            return switch (result.getErrorCode()) {
                case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
                case TENANT_ACCOUNT_NOT_FOUND -> HttpStatus.NOT_FOUND;
                case INSUFFICIENT_BALANCE, WITHDRAWAL_LIMIT_EXCEEDED, GATEWAY_REJECTED -> HttpStatus.UNPROCESSABLE_ENTITY;
                case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
                case GATEWAY_ERROR -> HttpStatus.BAD_GATEWAY;
            };
        }
        if (result.isDuplicate()) {
            return HttpStatus.OK;
        }
        return result.getStatus() == OperationStatus.PENDING ? HttpStatus.ACCEPTED : HttpStatus.CREATED;
    }
}
