package com.flagship.general_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A period closed with a balanced trial balance.
 */
@Value
public class FiscalPeriodClosedEvent implements LedgerEvent {

    public static final String EVENT_TYPE = "FiscalPeriodClosed";
    public static final String AGGREGATE_TYPE = "FiscalPeriod";

    UUID eventId;
    UUID periodId;
    int fiscalYear;
    int fiscalMonth;
    int accountsProcessed;
    long totalDebits;
    long totalCredits;
    String closedBy;
    Instant occurredAt;

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return periodId;
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
