package com.flagship.tenant_ledger.outbox;

import com.flagship.tenant_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ships audit events from the outbox to the audit topic.
 *
 * Sends are synchronous so events of one tenant keep their order. A failed
 * send bumps the retry counter; events past {@code max-retries} are left for
 * manual intervention.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.audit:ledger-audit}")
    private String auditTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished audit events", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        try {
            SendResult<String, String> result =
                    kafkaTemplate.send(auditTopic, event.partitionKey(), event.getPayload()).get();

            log.debug("Published audit event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted");
        } catch (Exception e) {
            log.error("Failed to publish audit event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            recordFailure(event, e.getMessage());
        }
    }

    private void recordFailure(OutboxEvent event, String error) {
        outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Audit event {} exceeded max retries ({}), left for manual handling. eventType={}, tenantId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getTenantId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
