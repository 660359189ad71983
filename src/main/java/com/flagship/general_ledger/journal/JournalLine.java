package com.flagship.general_ledger.journal;

import lombok.Value;

import java.util.UUID;

@Value
public class JournalLine {
    UUID id;
    UUID entryId;
    int lineNumber;
    UUID accountId;
    Direction direction;
    long amount;
    String memo;

    public boolean isDebit() {
        return direction == Direction.DEBIT;
    }
}
