package com.flagship.tenant_ledger.api;

import com.flagship.tenant_ledger.audit.AuditChannel;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of the operator alerts raised for a tenant.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}")
@RequiredArgsConstructor
@Validated
public class AuditController {

    private final AuditChannel auditChannel;

    @GetMapping("/audit-events")
    public ResponseEntity<List<AuditEventResponse>> events(
            @PathVariable("tenantId") Long tenantId,
            @RequestParam("type") @NotBlank String eventType) {
        return ResponseEntity.ok(auditChannel.history(tenantId, eventType).stream()
                .map(AuditEventResponse::from)
                .toList());
    }
}
