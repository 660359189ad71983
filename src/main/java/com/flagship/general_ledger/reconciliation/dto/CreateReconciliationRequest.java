package com.flagship.general_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class CreateReconciliationRequest {

    @NotNull(message = "Bank account ID is required")
    @JsonProperty("bank_account_id")
    UUID bankAccountId;

    @NotNull(message = "Fiscal year is required")
    @Min(value = 1900, message = "Fiscal year must be 1900 or later")
    @JsonProperty("fiscal_year")
    Integer fiscalYear;

    @NotNull(message = "Fiscal month is required")
    @Min(value = 1, message = "Fiscal month must be between 1 and 12")
    @Max(value = 12, message = "Fiscal month must be between 1 and 12")
    @JsonProperty("fiscal_month")
    Integer fiscalMonth;

    @NotNull(message = "Statement ending balance is required")
    @JsonProperty("statement_ending_balance")
    Long statementEndingBalance;

    /** Optional; defaults to the GL balance at month end. */
    @JsonProperty("book_ending_balance")
    Long bookEndingBalance;

    @NotBlank(message = "Created by is required")
    @JsonProperty("created_by")
    String createdBy;
}
