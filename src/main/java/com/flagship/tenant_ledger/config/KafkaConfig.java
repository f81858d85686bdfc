package com.flagship.tenant_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.time.Duration;

/**
 * Declares the audit topic that carries reconciliation mismatches, orphan
 * webhooks and pending-entry escalations to operators.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.audit:ledger-audit}")
    private String auditTopic;

    @Value("${kafka.topic.audit-partitions:3}")
    private int partitions;

    @Value("${kafka.topic.audit-retention:30d}")
    private Duration retention;

    /**
     * Keyed by tenant id so one tenant's events stay ordered within a partition.
     */
    @Bean
    public NewTopic auditTopic() {
        return TopicBuilder.name(auditTopic)
                .partitions(partitions)
                .replicas(1)
                .config(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(retention.toMillis()))
                .build();
    }
}
