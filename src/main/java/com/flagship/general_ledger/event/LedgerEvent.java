package com.flagship.general_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain event published through the outbox.
 *
 * Events are facts about things that already happened; consumers
 * deduplicate on the event ID.
 */
public interface LedgerEvent {

    UUID getEventId();

    /**
     * The journal entry or fiscal period the event is about. Used as the Kafka key.
     */
    UUID getAggregateId();

    String getAggregateType();

    Instant getOccurredAt();

    String getEventType();
}
