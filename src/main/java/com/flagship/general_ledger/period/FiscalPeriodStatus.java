package com.flagship.general_ledger.period;

/**
 * OPEN accepts postings. CLOSED is final until reopened. LOCKED is terminal.
 */
public enum FiscalPeriodStatus {
    OPEN,
    CLOSED,
    LOCKED
}
