package com.flagship.general_ledger.journal;

public enum JournalEntryType {
    MANUAL,
    SYSTEM,
    RECURRING,
    ADJUSTING,
    CLOSING
}
