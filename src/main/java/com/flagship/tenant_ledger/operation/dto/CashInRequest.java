package com.flagship.tenant_ledger.operation.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tenant_ledger.gateway.PaymentMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Request to collect money into a tenant's balance through a PIX charge or a boleto.
 *
 * The tenant comes from the URL path and is attached with {@link #withTenantId}.
 */
@Value
@Builder
@Jacksonized
public class CashInRequest {

    @With
    @JsonIgnore
    Long tenantId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be at least 0.01")
    @DecimalMax(value = "100000.00", message = "Amount must not exceed 100000.00")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Reference id is required")
    @Size(max = 255)
    @JsonProperty("reference_id")
    String referenceId;

    @NotNull(message = "Payment method is required")
    @JsonProperty("method")
    PaymentMethod method;

    @Valid
    @JsonProperty("payer")
    Payer payer;

    @Size(max = 500)
    @JsonProperty("description")
    String description;

    /** Boleto only. */
    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @Value
    public static class Payer {
        @NotBlank(message = "Payer name is required")
        @JsonProperty("name")
        String name;

        @NotBlank(message = "Payer document is required")
        @JsonProperty("document")
        String document;

        @Email
        @JsonProperty("email")
        String email;
    }
}
