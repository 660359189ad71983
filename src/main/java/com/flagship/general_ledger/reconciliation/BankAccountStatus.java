package com.flagship.general_ledger.reconciliation;

public enum BankAccountStatus {
    ACTIVE,
    INACTIVE,
    CLOSED
}
