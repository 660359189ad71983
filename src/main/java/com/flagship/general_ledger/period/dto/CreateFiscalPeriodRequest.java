package com.flagship.general_ledger.period.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class CreateFiscalPeriodRequest {

    @NotNull(message = "Fiscal year is required")
    @Min(value = 1900, message = "Fiscal year must be 1900 or later")
    @JsonProperty("fiscal_year")
    Integer fiscalYear;

    @NotNull(message = "Fiscal month is required")
    @Min(value = 1, message = "Fiscal month must be between 1 and 12")
    @Max(value = 12, message = "Fiscal month must be between 1 and 12")
    @JsonProperty("fiscal_month")
    Integer fiscalMonth;
}
