package com.flagship.general_ledger.exception;

public class NotReconciledException extends LedgerException {

    public static final String CODE = "NOT_RECONCILED";

    public NotReconciledException(String message) {
        super(CODE, message);
    }
}
