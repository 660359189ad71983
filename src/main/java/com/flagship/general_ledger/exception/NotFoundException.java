package com.flagship.general_ledger.exception;

public class NotFoundException extends LedgerException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(CODE, message);
    }

    public static NotFoundException of(String entityType, Object id) {
        return new NotFoundException(String.format("%s not found: %s", entityType, id));
    }
}
