package com.flagship.general_ledger.reconciliation;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One line of an imported bank statement. Positive amounts are money into
 * the bank account.
 */
@Value
public class BankTransaction {
    UUID id;
    UUID reconciliationId;
    long sequenceNumber;
    LocalDate transactionDate;
    String description;
    long amount;
    String reference;
    MatchStatus matchStatus;
    UUID matchedJournalLineId;
    String matchedBy;
    Instant matchedAt;

    public boolean isMatched() {
        return matchStatus == MatchStatus.MATCHED;
    }
}
