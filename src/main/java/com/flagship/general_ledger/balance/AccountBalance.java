package com.flagship.general_ledger.balance;

import com.flagship.general_ledger.account.NormalBalance;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Derived balance of one account for one fiscal period.
 *
 * Closing balance is signed on the account's normal side: a positive
 * closing balance on a CREDIT-normal liability means the business owes money.
 */
@Value
public class AccountBalance {
    UUID accountId;
    int fiscalYear;
    int fiscalMonth;
    long openingBalance;
    long debitTotal;
    long creditTotal;
    long closingBalance;
    Instant calculatedAt;

    /**
     * DEBIT-normal: closing = opening + debits - credits.
     * CREDIT-normal: closing = opening + credits - debits.
     *
     * @throws ArithmeticException on overflow
     */
    public static AccountBalance calculate(UUID accountId, int fiscalYear, int fiscalMonth,
                                           NormalBalance normalBalance, long openingBalance,
                                           long debitTotal, long creditTotal, Instant calculatedAt) {
        long closing = switch (normalBalance) {
            case DEBIT -> Math.subtractExact(Math.addExact(openingBalance, debitTotal), creditTotal);
            case CREDIT -> Math.subtractExact(Math.addExact(openingBalance, creditTotal), debitTotal);
        };
        return new AccountBalance(accountId, fiscalYear, fiscalMonth,
            openingBalance, debitTotal, creditTotal, closing, calculatedAt);
    }

    /**
     * Same numbers, ignoring when they were computed.
     */
    public boolean sameAmountsAs(AccountBalance other) {
        return accountId.equals(other.accountId)
            && fiscalYear == other.fiscalYear
            && fiscalMonth == other.fiscalMonth
            && openingBalance == other.openingBalance
            && debitTotal == other.debitTotal
            && creditTotal == other.creditTotal
            && closingBalance == other.closingBalance;
    }
}
