package com.flagship.general_ledger.journal;

import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * A journal line of a POSTED entry, with the entry fields reconciliation needs.
 */
@Value
public class PostedLine {
    UUID lineId;
    UUID entryId;
    String entryNumber;
    LocalDate entryDate;
    int lineNumber;
    UUID accountId;
    Direction direction;
    long amount;
    String memo;
}
