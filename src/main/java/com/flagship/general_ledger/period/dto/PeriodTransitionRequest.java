package com.flagship.general_ledger.period.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Body of close, reopen and lock. The reason is only read by reopen.
 */
@Value
public class PeriodTransitionRequest {

    @NotBlank(message = "Performed by is required")
    @JsonProperty("performed_by")
    String performedBy;

    @JsonProperty("reason")
    String reason;
}
