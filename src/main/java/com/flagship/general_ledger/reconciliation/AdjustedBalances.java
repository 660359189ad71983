package com.flagship.general_ledger.reconciliation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.exception.ValidationException;
import lombok.Value;

import java.util.List;

/**
 * Statement and book balances brought to a common basis by the reconciling items.
 *
 * <pre>
 *   adjusted bank = statement - outstanding checks + deposits in transit
 *   adjusted book = book - bank fees + bank interest - NSF checks + adjustments
 * </pre>
 *
 * Reconciled only when the two are exactly equal.
 */
@Value
public class AdjustedBalances {

    @JsonProperty("statement_ending_balance")
    long statementEndingBalance;

    @JsonProperty("book_ending_balance")
    long bookEndingBalance;

    @JsonProperty("adjusted_bank_balance")
    long adjustedBankBalance;

    @JsonProperty("adjusted_book_balance")
    long adjustedBookBalance;

    public static AdjustedBalances calculate(long statementEndingBalance, long bookEndingBalance,
                                             List<ReconcilingItem> items) {
        long bank = statementEndingBalance;
        long book = bookEndingBalance;
        try {
            for (ReconcilingItem item : items) {
                long amount = item.getAmount();
                switch (item.getItemType()) {
                    case OUTSTANDING_CHECK -> bank = Math.subtractExact(bank, amount);
                    case DEPOSIT_IN_TRANSIT -> bank = Math.addExact(bank, amount);
                    case BANK_FEE, NSF_CHECK -> book = Math.subtractExact(book, amount);
                    case BANK_INTEREST, ADJUSTMENT -> book = Math.addExact(book, amount);
                }
            }
        } catch (ArithmeticException e) {
            throw new ValidationException("Adjusted balance overflows", e);
        }
        return new AdjustedBalances(statementEndingBalance, bookEndingBalance, bank, book);
    }

    @JsonProperty("difference")
    public long getDifference() {
        return adjustedBankBalance - adjustedBookBalance;
    }

    @JsonProperty("is_reconciled")
    public boolean isReconciled() {
        return adjustedBankBalance == adjustedBookBalance;
    }
}
