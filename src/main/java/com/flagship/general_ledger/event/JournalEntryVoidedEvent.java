package com.flagship.general_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A posted entry was voided. No reversing entry is created; balances
 * recalculated after this event exclude the entry's lines.
 */
@Value
public class JournalEntryVoidedEvent implements LedgerEvent {

    public static final String EVENT_TYPE = "JournalEntryVoided";

    UUID eventId;
    UUID entryId;
    String entryNumber;
    LocalDate entryDate;
    int fiscalYear;
    int fiscalMonth;
    String periodStatus;
    String reason;
    String voidedBy;
    Instant occurredAt;

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return entryId;
    }

    @Override
    public String getAggregateType() {
        return JournalEntryPostedEvent.AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
