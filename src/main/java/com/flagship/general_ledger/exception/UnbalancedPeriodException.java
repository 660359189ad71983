package com.flagship.general_ledger.exception;

import lombok.Getter;

/**
 * Raised when a period cannot be closed because its trial balance does not balance.
 */
@Getter
public class UnbalancedPeriodException extends LedgerException {

    public static final String CODE = "UNBALANCED_PERIOD";

    private final long totalDebits;
    private final long totalCredits;

    public UnbalancedPeriodException(int fiscalYear, int fiscalMonth, long totalDebits, long totalCredits) {
        super(CODE, String.format(
            "Trial balance for %d-%02d is not balanced: debits=%d, credits=%d, difference=%d",
            fiscalYear, fiscalMonth, totalDebits, totalCredits, totalDebits - totalCredits));
        this.totalDebits = totalDebits;
        this.totalCredits = totalCredits;
    }
}
