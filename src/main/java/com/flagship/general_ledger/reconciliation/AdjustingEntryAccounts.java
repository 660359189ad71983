package com.flagship.general_ledger.reconciliation;

import lombok.Value;

import java.util.UUID;

/**
 * GL accounts that adjusting entries are booked against.
 * NSF checks fall back to the fee expense account when no NSF account is given.
 */
@Value
public class AdjustingEntryAccounts {
    UUID feeExpenseAccountId;
    UUID interestIncomeAccountId;
    UUID nsfAccountId;

    public UUID nsfOrFeeAccountId() {
        return nsfAccountId != null ? nsfAccountId : feeExpenseAccountId;
    }
}
