package com.flagship.general_ledger.period;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Read-only pre-close report. Only an unbalanced trial balance (or a period
 * that is not OPEN) blocks the close; the rest are warnings.
 */
@Value
public class CloseChecklist {

    @JsonProperty("period_id")
    UUID periodId;

    @JsonProperty("fiscal_year")
    int fiscalYear;

    @JsonProperty("fiscal_month")
    int fiscalMonth;

    @JsonProperty("status")
    FiscalPeriodStatus status;

    @JsonProperty("trial_balance_balanced")
    boolean trialBalanceBalanced;

    @JsonProperty("total_debits")
    long totalDebits;

    @JsonProperty("total_credits")
    long totalCredits;

    @JsonProperty("draft_entry_count")
    int draftEntryCount;

    /** Null when the previous month has no fiscal period. */
    @JsonProperty("previous_period_status")
    FiscalPeriodStatus previousPeriodStatus;

    @JsonProperty("blockers")
    List<String> blockers;

    @JsonProperty("warnings")
    List<String> warnings;

    @JsonProperty("ready_to_close")
    public boolean isReadyToClose() {
        return blockers.isEmpty();
    }
}
