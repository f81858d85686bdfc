package com.flagship.tenant_ledger.tenant;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class JdbcGatewayAccountDirectory implements GatewayAccountDirectory {

    private final JdbcTemplate jdbcTemplate;

    public JdbcGatewayAccountDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<GatewayAccount> findByTenantId(Long tenantId) {
        return jdbcTemplate.query(
            "SELECT tenant_id, external_account_id, status, created_at FROM gateway_accounts WHERE tenant_id = ?",
            accountRowMapper(),
            tenantId
        ).stream().findFirst();
    }

    @Override
    public List<GatewayAccount> findActiveAccounts() {
        return jdbcTemplate.query(
            "SELECT tenant_id, external_account_id, status, created_at FROM gateway_accounts " +
            "WHERE status = 'ACTIVE' ORDER BY tenant_id",
            accountRowMapper()
        );
    }

    private RowMapper<GatewayAccount> accountRowMapper() {
        return (rs, rowNum) -> new GatewayAccount(
            rs.getLong("tenant_id"),
            rs.getString("external_account_id"),
            GatewayAccountStatus.valueOf(rs.getString("status")),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
