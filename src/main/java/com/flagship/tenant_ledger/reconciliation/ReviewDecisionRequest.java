package com.flagship.tenant_ledger.reconciliation;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An operator's verdict on a mismatched reconciliation run.
 */
@Value
@Builder
@Jacksonized
public class ReviewDecisionRequest {

    /** RESOLVED or DISMISSED. */
    @NotNull(message = "Outcome is required")
    @JsonProperty("outcome")
    ReviewStatus outcome;

    @NotBlank(message = "Operator is required")
    @Size(max = 100)
    @JsonProperty("resolved_by")
    String resolvedBy;

    @Size(max = 2000)
    @JsonProperty("notes")
    String notes;
}
