package com.flagship.general_ledger.account;

/**
 * The side on which an account's balance naturally increases.
 */
public enum NormalBalance {
    DEBIT,
    CREDIT
}
