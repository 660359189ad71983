package com.flagship.general_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Body of complete and approve.
 */
@Value
public class ReconciliationActionRequest {

    @NotBlank(message = "Performed by is required")
    @JsonProperty("performed_by")
    String performedBy;
}
