package com.flagship.general_ledger.reconciliation;

public enum ReconciliationStatus {
    DRAFT,
    IN_PROGRESS,
    COMPLETED,
    APPROVED;

    public boolean isFinished() {
        return this == COMPLETED || this == APPROVED;
    }
}
