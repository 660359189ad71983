package com.flagship.general_ledger.balance;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class RecalculationResult {

    @JsonProperty("fiscal_year")
    int fiscalYear;

    @JsonProperty("fiscal_month")
    int fiscalMonth;

    @JsonProperty("accounts_processed")
    int accountsProcessed;

    @JsonProperty("total_debits")
    long totalDebits;

    @JsonProperty("total_credits")
    long totalCredits;

    @JsonProperty("is_balanced")
    public boolean isBalanced() {
        return totalDebits == totalCredits;
    }
}
