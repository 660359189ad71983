package com.flagship.general_ledger.balance;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.account.NormalBalance;
import com.flagship.general_ledger.period.FiscalPeriodStatus;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only trial balance for one period.
 *
 * {@code totalDebits}/{@code totalCredits} are the period's posted debit and
 * credit turnover, the same figures the close check compares.
 */
@Value
public class TrialBalance {

    public enum Source {
        /** Read from balances stored by the last recalculation. */
        CALCULATED,
        /** Computed from posted lines without writing anything. */
        LIVE
    }

    @JsonProperty("fiscal_year")
    int fiscalYear;

    @JsonProperty("fiscal_month")
    int fiscalMonth;

    @JsonProperty("period_status")
    FiscalPeriodStatus periodStatus;

    @JsonProperty("source")
    Source source;

    @JsonProperty("rows")
    List<Row> rows;

    @JsonProperty("subtotals")
    Map<AccountType, Subtotal> subtotals;

    @JsonProperty("total_debits")
    long totalDebits;

    @JsonProperty("total_credits")
    long totalCredits;

    @JsonProperty("is_balanced")
    public boolean isBalanced() {
        return totalDebits == totalCredits;
    }

    @JsonProperty("difference")
    public long getDifference() {
        return totalDebits - totalCredits;
    }

    @Value
    public static class Row {

        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("code")
        String code;

        @JsonProperty("name")
        String name;

        @JsonProperty("account_type")
        AccountType accountType;

        @JsonProperty("normal_balance")
        NormalBalance normalBalance;

        @JsonProperty("opening_balance")
        long openingBalance;

        @JsonProperty("debit_total")
        long debitTotal;

        @JsonProperty("credit_total")
        long creditTotal;

        @JsonProperty("closing_balance")
        long closingBalance;

        /**
         * Closing balance presented in the debit column. A negative balance on a
         * DEBIT-normal account shows up in the credit column instead.
         */
        @JsonProperty("debit_balance")
        public long getDebitBalance() {
            return switch (normalBalance) {
                case DEBIT -> Math.max(closingBalance, 0);
                case CREDIT -> Math.max(-closingBalance, 0);
            };
        }

        @JsonProperty("credit_balance")
        public long getCreditBalance() {
            return switch (normalBalance) {
                case DEBIT -> Math.max(-closingBalance, 0);
                case CREDIT -> Math.max(closingBalance, 0);
            };
        }
    }

    @Value
    public static class Subtotal {

        @JsonProperty("debit_total")
        long debitTotal;

        @JsonProperty("credit_total")
        long creditTotal;

        @JsonProperty("debit_balance")
        long debitBalance;

        @JsonProperty("credit_balance")
        long creditBalance;
    }
}
