package com.flagship.general_ledger.exception;

/**
 * The fiscal period an entry belongs to no longer accepts changes.
 */
public class PeriodClosedException extends LedgerException {

    public static final String CODE = "PERIOD_CLOSED";

    public PeriodClosedException(int fiscalYear, int fiscalMonth, String status) {
        super(CODE, String.format("Fiscal period %d-%02d is %s", fiscalYear, fiscalMonth, status));
    }

    public PeriodClosedException(String message) {
        super(CODE, message);
    }
}
