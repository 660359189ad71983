package com.flagship.general_ledger.balance;

import com.flagship.general_ledger.account.Account;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Pure computation of period balances from line totals and prior closings.
 *
 * Every account gets a row, including accounts with no activity, so the
 * next period always finds an opening balance to carry forward.
 */
public final class BalanceCalculator {

    private BalanceCalculator() {
    }

    public static Result calculate(int fiscalYear, int fiscalMonth,
                                   List<Account> accounts,
                                   Map<UUID, AccountLineTotals> lineTotals,
                                   Map<UUID, Long> openingBalances,
                                   Instant calculatedAt) {
        List<AccountBalance> balances = new ArrayList<>(accounts.size());
        long totalDebits = 0;
        long totalCredits = 0;

        for (Account account : accounts) {
            AccountLineTotals totals = lineTotals.getOrDefault(account.getId(),
                AccountLineTotals.empty(account.getId()));
            long opening = openingBalances.getOrDefault(account.getId(), 0L);

            balances.add(AccountBalance.calculate(
                account.getId(), fiscalYear, fiscalMonth, account.getNormalBalance(),
                opening, totals.getDebitTotal(), totals.getCreditTotal(), calculatedAt));

            totalDebits = Math.addExact(totalDebits, totals.getDebitTotal());
            totalCredits = Math.addExact(totalCredits, totals.getCreditTotal());
        }

        return new Result(Collections.unmodifiableList(balances), totalDebits, totalCredits);
    }

    @Value
    public static class Result {
        List<AccountBalance> balances;
        long totalDebits;
        long totalCredits;

        public boolean isBalanced() {
            return totalDebits == totalCredits;
        }
    }
}
