package com.flagship.general_ledger.journal;

/**
 * DRAFT -> POSTED -> VOIDED. Only POSTED lines count toward balances.
 */
public enum JournalEntryStatus {
    DRAFT,
    POSTED,
    VOIDED
}
