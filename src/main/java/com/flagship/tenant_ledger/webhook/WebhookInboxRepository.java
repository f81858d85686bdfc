package com.flagship.tenant_ledger.webhook;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WebhookInboxRepository extends JpaRepository<WebhookInboxEntity, UUID> {

    @Query("""
        SELECT w FROM WebhookInboxEntity w
        WHERE w.payloadHash = :payloadHash
          AND w.result <> com.flagship.tenant_ledger.webhook.WebhookResult.REJECTED
        """)
    Optional<WebhookInboxEntity> findAccepted(@Param("payloadHash") String payloadHash);

    List<WebhookInboxEntity> findByGatewayTransactionIdOrderByReceivedAtAsc(String gatewayTransactionId);

    long countByResult(WebhookResult result);
}
