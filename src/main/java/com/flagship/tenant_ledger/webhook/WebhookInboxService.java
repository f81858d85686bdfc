package com.flagship.tenant_ledger.webhook;

import com.flagship.tenant_ledger.gateway.GatewayWebhookEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookInboxService {

    private final WebhookInboxRepository repository;

    /**
     * If this exact payload was already accepted, counts the redelivery and
     * returns the earlier outcome.
     */
    @Transactional
    public Optional<WebhookResult> registerRedelivery(String payloadHash) {
        return repository.findAccepted(payloadHash).map(existing -> {
            existing.redelivered();
            log.info("Webhook redelivered: inboxId={}, deliveryCount={}, previousResult={}",
                    existing.getId(), existing.getDeliveryCount(), existing.getResult());
            return existing.getResult();
        });
    }

    @Transactional
    public UUID recordAccepted(String payloadHash, String payload, String signature,
                               GatewayWebhookEvent event, WebhookResult result, String detail) {
        WebhookInboxEntity saved = repository.save(WebhookInboxEntity.received(
                payloadHash, payload, signature,
                event.getGatewayTransactionId(), event.getCorrelationId(),
                event.getStatus() != null ? event.getStatus().name() : null,
                result, detail));
        return saved.getId();
    }

    /**
     * Stores a delivery that failed verification or could not be parsed.
     */
    @Transactional
    public UUID recordRejected(String payloadHash, String payload, String signature, String detail) {
        WebhookInboxEntity saved = repository.save(WebhookInboxEntity.received(
                payloadHash, payload, signature, null, null, null, WebhookResult.REJECTED, detail));
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public List<WebhookInboxEntity> findByGatewayTransactionId(String gatewayTransactionId) {
        return repository.findByGatewayTransactionIdOrderByReceivedAtAsc(gatewayTransactionId);
    }
}
