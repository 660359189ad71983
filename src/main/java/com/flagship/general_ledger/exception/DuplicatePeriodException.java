package com.flagship.general_ledger.exception;

public class DuplicatePeriodException extends LedgerException {

    public static final String CODE = "DUPLICATE_PERIOD";

    public DuplicatePeriodException(int fiscalYear, int fiscalMonth) {
        super(CODE, String.format("Fiscal period %d-%02d already exists", fiscalYear, fiscalMonth));
    }
}
