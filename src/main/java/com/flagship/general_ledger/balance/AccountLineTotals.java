package com.flagship.general_ledger.balance;

import lombok.Value;

import java.util.UUID;

/**
 * Sum of an account's POSTED debit and credit lines within one period.
 */
@Value
public class AccountLineTotals {
    UUID accountId;
    long debitTotal;
    long creditTotal;

    public static AccountLineTotals empty(UUID accountId) {
        return new AccountLineTotals(accountId, 0L, 0L);
    }
}
