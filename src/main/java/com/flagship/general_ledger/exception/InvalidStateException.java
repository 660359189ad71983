package com.flagship.general_ledger.exception;

/**
 * The requested transition is not allowed from the current state.
 */
public class InvalidStateException extends LedgerException {

    public static final String CODE = "INVALID_STATE";

    public InvalidStateException(String message) {
        super(CODE, message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
