package com.flagship.general_ledger.reconciliation;

public enum MatchStatus {
    UNMATCHED,
    MATCHED
}
