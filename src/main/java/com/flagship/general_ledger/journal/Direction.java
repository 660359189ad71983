package com.flagship.general_ledger.journal;

public enum Direction {
    DEBIT,
    CREDIT
}
