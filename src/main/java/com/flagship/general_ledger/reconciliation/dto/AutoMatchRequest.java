package com.flagship.general_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class AutoMatchRequest {

    @Min(value = 0, message = "Date tolerance must not be negative")
    @Max(value = 31, message = "Date tolerance must be at most 31 days")
    @JsonProperty("date_tolerance_days")
    Integer dateToleranceDays;

    @NotBlank(message = "Matched by is required")
    @JsonProperty("matched_by")
    String matchedBy;
}
