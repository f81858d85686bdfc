package com.flagship.tenant_ledger.operation.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Request to pay money out of a tenant's balance to a bank account.
 */
@Value
@Builder
@Jacksonized
public class CashOutRequest {

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

    @NotNull(message = "Destination bank account is required")
    @Valid
    @JsonProperty("destination")
    Destination destination;

    @Size(max = 500)
    @JsonProperty("description")
    String description;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @Value
    public static class Destination {
        @NotBlank
        @JsonProperty("bank_code")
        String bankCode;

        @NotBlank
        @JsonProperty("branch")
        String branch;

        @NotBlank
        @JsonProperty("account_number")
        String accountNumber;

        @JsonProperty("account_type")
        String accountType;

        @NotBlank
        @JsonProperty("holder_name")
        String holderName;

        @NotBlank
        @JsonProperty("holder_document")
        String holderDocument;
    }
}
