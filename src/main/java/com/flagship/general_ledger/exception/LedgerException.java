package com.flagship.general_ledger.exception;

import lombok.Getter;

/**
 * Base class for all ledger errors.
 *
 * Every subclass carries a stable error code that the REST layer
 * returns to callers, so clients can branch on the code rather than
 * on the message text.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final String errorCode;

    protected LedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
