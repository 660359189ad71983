package com.flagship.general_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A draft entry became part of the books.
 */
@Value
public class JournalEntryPostedEvent implements LedgerEvent {

    public static final String EVENT_TYPE = "JournalEntryPosted";
    public static final String AGGREGATE_TYPE = "JournalEntry";

    UUID eventId;
    UUID entryId;
    String entryNumber;
    LocalDate entryDate;
    int fiscalYear;
    int fiscalMonth;
    String entryType;
    long totalAmount;
    int lineCount;
    String postedBy;
    Instant occurredAt;

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return entryId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
