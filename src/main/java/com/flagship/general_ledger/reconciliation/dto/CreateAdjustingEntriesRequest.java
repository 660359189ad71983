package com.flagship.general_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.reconciliation.AdjustingEntryAccounts;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.util.UUID;

@Value
public class CreateAdjustingEntriesRequest {

    @JsonProperty("fee_expense_account_id")
    UUID feeExpenseAccountId;

    @JsonProperty("interest_income_account_id")
    UUID interestIncomeAccountId;

    @JsonProperty("nsf_account_id")
    UUID nsfAccountId;

    @NotBlank(message = "Created by is required")
    @JsonProperty("created_by")
    String createdBy;

    public AdjustingEntryAccounts toAccounts() {
        return new AdjustingEntryAccounts(feeExpenseAccountId, interestIncomeAccountId, nsfAccountId);
    }
}
