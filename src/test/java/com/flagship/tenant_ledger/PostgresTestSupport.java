package com.flagship.tenant_ledger;

import com.flagship.tenant_ledger.gateway.GatewayAdapter;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Shared PostgreSQL container for the Spring integration tests.
 *
 * The container is started once per JVM so cached application contexts keep a
 * live database. Tests isolate themselves by using a fresh tenant id.
 *
 * Redis and the gateway are mocked for every subclass so they all share one
 * application context. An unstubbed Redis template makes the rate limiter fall
 * back to counting log rows in the database.
 */
public abstract class PostgresTestSupport {

    @MockBean
    protected StringRedisTemplate redisTemplate;

    @MockBean
    protected GatewayAdapter gatewayAdapter;

    protected static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("tenant_ledger_test")
            .withUsername("test")
            .withPassword("test");

    static {
        postgres.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker in tests, events stay in the outbox
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("ledger.scheduling.enabled", () -> "false");
        registry.add("gateway.base-url", () -> "http://gateway.test");
        registry.add("gateway.webhook-secret", () -> "test-webhook-secret");
    }

    protected static long newTenantId() {
        return ThreadLocalRandom.current().nextLong(1_000_000L, Long.MAX_VALUE / 2);
    }

    protected static long registerTenant(JdbcTemplate jdbcTemplate) {
        long tenantId = newTenantId();
        jdbcTemplate.update(
            "INSERT INTO gateway_accounts (tenant_id, external_account_id, status) VALUES (?, ?, 'ACTIVE')",
            tenantId, "acct-" + tenantId);
        return tenantId;
    }
}
