package com.flagship.general_ledger.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.balance.AccountBalance;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountBalanceResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("fiscal_year")
    int fiscalYear;

    @JsonProperty("fiscal_month")
    int fiscalMonth;

    @JsonProperty("opening_balance")
    long openingBalance;

    @JsonProperty("debit_total")
    long debitTotal;

    @JsonProperty("credit_total")
    long creditTotal;

    @JsonProperty("closing_balance")
    long closingBalance;

    @JsonProperty("calculated_at")
    Instant calculatedAt;

    public static AccountBalanceResponse from(AccountBalance balance) {
        return AccountBalanceResponse.builder()
            .accountId(balance.getAccountId())
            .fiscalYear(balance.getFiscalYear())
            .fiscalMonth(balance.getFiscalMonth())
            .openingBalance(balance.getOpeningBalance())
            .debitTotal(balance.getDebitTotal())
            .creditTotal(balance.getCreditTotal())
            .closingBalance(balance.getClosingBalance())
            .calculatedAt(balance.getCalculatedAt())
            .build();
    }
}
