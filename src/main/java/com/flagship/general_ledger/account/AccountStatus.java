package com.flagship.general_ledger.account;

public enum AccountStatus {
    ACTIVE,
    /** Kept for history; new journal lines cannot reference it. */
    INACTIVE
}
