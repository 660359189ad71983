package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.exception.ValidationException;
import lombok.Value;

import java.time.LocalDate;

/**
 * A statement transaction as submitted for import. Two lines with the same
 * date, amount and reference are the same transaction.
 */
@Value
public class StatementLine {
    LocalDate transactionDate;
    String description;
    long amount;
    String reference;

    public void validate(int index) {
        if (transactionDate == null) {
            throw new ValidationException("Statement line " + index + ": transaction date is required");
        }
        if (amount == 0) {
            throw new ValidationException("Statement line " + index + ": amount must not be zero");
        }
    }

    /** Null references are stored as empty so they take part in duplicate detection. */
    public String normalizedReference() {
        return reference == null ? "" : reference.trim();
    }
}
