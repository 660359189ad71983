package com.flagship.general_ledger.exception;

/**
 * Input violates a structural or business rule (unbalanced entry, bad code, short reason).
 */
public class ValidationException extends LedgerException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(CODE, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
