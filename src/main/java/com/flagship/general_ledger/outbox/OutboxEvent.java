package com.flagship.general_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event or audit record waiting in the outbox.
 *
 * Rows are written in the same transaction as the ledger change they
 * describe and published to Kafka afterwards, so a rolled back post,
 * void or close never produces an event.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g. "JournalEntry", "FiscalPeriod", "AuditLog"
    UUID aggregateId;
    String eventType;          // e.g. "JournalEntryPosted"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
