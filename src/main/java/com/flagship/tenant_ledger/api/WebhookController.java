package com.flagship.tenant_ledger.api;

import com.flagship.tenant_ledger.operation.LedgerService;
import com.flagship.tenant_ledger.webhook.WebhookResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives gateway notifications.
 *
 * The body is taken as the raw string so the signature is checked over the
 * exact bytes the gateway signed. Any accepted delivery, including orphans and
 * redeliveries, is answered with 202 so the gateway stops retrying.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final LedgerService ledgerService;

    @PostMapping("/gateway")
    public ResponseEntity<Map<String, String>> receive(
            @RequestBody String payload,
            @RequestHeader(value = "${gateway.signature-header:X-Signature}", required = false) String signature) {
        WebhookResult result = ledgerService.handleWebhook(payload, signature);
        log.debug("Webhook handled: result={}", result);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("result", result.name()));
    }
}
