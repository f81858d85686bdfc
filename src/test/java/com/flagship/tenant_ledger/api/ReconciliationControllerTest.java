package com.flagship.tenant_ledger.api;

import com.flagship.tenant_ledger.PostgresTestSupport;
import com.flagship.tenant_ledger.audit.event.ReconciliationMismatchEvent;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class ReconciliationControllerTest extends PostgresTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long tenantId;

    @BeforeEach
    void setUp() {
        tenantId = registerTenant(jdbcTemplate);
    }

    /** Runs a sync against a gateway that reports more money than the empty ledger holds. */
    private String mismatchedRun() throws Exception {
        when(gatewayAdapter.getBalance("acct-" + tenantId)).thenReturn(new BigDecimal("25.00"));
        String body = mockMvc.perform(post("/api/tenants/{tenantId}/reconciliation", tenantId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reconciled").value(false))
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(body, "$.report_id");
    }

    @Test
    @DisplayName("A mismatched run shows up as latest, in history and in the pending reviews")
    void mismatchedRunListed() throws Exception {
        String reportId = mismatchedRun();

        mockMvc.perform(get("/api/tenants/{tenantId}/reconciliation/latest", tenantId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report_id").value(reportId))
                .andExpect(jsonPath("$.review_status").value("PENDING_REVIEW"))
                .andExpect(jsonPath("$.discrepancies").isArray());

        mockMvc.perform(get("/api/tenants/{tenantId}/reconciliation/reports", tenantId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].report_id").value(reportId));

        mockMvc.perform(get("/api/tenants/{tenantId}/reconciliation/reports/pending", tenantId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].report_id").value(hasItem(reportId)));

        mockMvc.perform(get("/api/reconciliation/pending-reviews"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].report_id").value(hasItem(reportId)));
    }

    @Test
    @DisplayName("Resolving a review closes it; a second verdict is a 409")
    void resolveReview() throws Exception {
        String reportId = mismatchedRun();
        String verdict = """
                {"outcome": "RESOLVED", "resolved_by": "ops@flagship", "notes": "Deposit booked next day"}
                """;

        mockMvc.perform(post("/api/tenants/{tenantId}/reconciliation/reports/{reportId}/review", tenantId, reportId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(verdict))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.review_status").value("RESOLVED"))
                .andExpect(jsonPath("$.resolved_by").value("ops@flagship"))
                .andExpect(jsonPath("$.resolved_at").exists());

        mockMvc.perform(get("/api/tenants/{tenantId}/reconciliation/reports/pending", tenantId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].report_id").value(not(hasItem(reportId))));

        mockMvc.perform(post("/api/tenants/{tenantId}/reconciliation/reports/{reportId}/review", tenantId, reportId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(verdict))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATE_TRANSITION"));
    }

    @Test
    @DisplayName("A verdict without an operator is a 400")
    void verdictNeedsOperator() throws Exception {
        String reportId = mismatchedRun();

        mockMvc.perform(post("/api/tenants/{tenantId}/reconciliation/reports/{reportId}/review", tenantId, reportId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outcome\": \"DISMISSED\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.resolvedBy").exists());
    }

    @Test
    @DisplayName("404 when the tenant has never been reconciled")
    void noLatestReport() throws Exception {
        mockMvc.perform(get("/api/tenants/{tenantId}/reconciliation/latest", newTenantId()))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("The mismatch alert is listed in the tenant's audit events")
    void mismatchAlertListed() throws Exception {
        String reportId = mismatchedRun();

        mockMvc.perform(get("/api/tenants/{tenantId}/audit-events", tenantId)
                        .param("type", ReconciliationMismatchEvent.EVENT_TYPE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].event_type").value(ReconciliationMismatchEvent.EVENT_TYPE))
                .andExpect(jsonPath("$[0].payload.reportId").value(reportId));
    }
}
