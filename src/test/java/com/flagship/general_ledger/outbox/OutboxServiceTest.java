package com.flagship.general_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.general_ledger.AbstractIntegrationTest;
import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.event.FiscalPeriodClosedEvent;
import com.flagship.general_ledger.event.JournalEntryPostedEvent;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.period.FiscalPeriod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static com.flagship.general_ledger.journal.JournalEntryRequest.Line.credit;
import static com.flagship.general_ledger.journal.JournalEntryRequest.Line.debit;
import static org.junit.jupiter.api.Assertions.*;

/**
 * These tests verify that:
 * - Events are written to the outbox atomically with ledger changes
 * - Unpublished events can be fetched, marked published or failed
 * - Event payloads carry the ledger data consumers need
 */
class OutboxServiceTest extends AbstractIntegrationTest {

    private static final int MAX_RETRIES = 5;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private ObjectMapper objectMapper;

    private Account cash;
    private Account sales;
    private FiscalPeriod january;

    @BeforeEach
    void setUp() {
        cash = createAccount("1100", "Cash", AccountType.ASSET);
        sales = createAccount("4100", "Sales", AccountType.REVENUE);
        january = openPeriod(2026, 1);
    }

    private JournalEntry postSale(long amount) {
        return createAndPost(LocalDate.of(2026, 1, 12), "Cash sale",
            debit(cash.getId(), amount, null), credit(sales.getId(), amount, null));
    }

    @Test
    @DisplayName("Outbox event should be created with correct data")
    @Transactional
    void testSaveEvent_CreatesCorrectEvent() throws Exception {
        printTestHeader("Save Event - Creates Correct Event");

        UUID aggregateId = UUID.randomUUID();
        TestPayload payload = new TestPayload("test-value", 123);

        OutboxEvent event = outboxService.saveEvent("JournalEntry", aggregateId, "TestEvent", payload);
        printOutput("Payload", event.getPayload());

        assertNotNull(event.getId(), "Event ID should be generated");
        assertEquals("JournalEntry", event.getAggregateType());
        assertEquals(aggregateId, event.getAggregateId());
        assertEquals("TestEvent", event.getEventType());
        assertFalse(event.isPublished(), "Event should not be published yet");
        assertEquals(0, event.getRetryCount());

        TestPayload deserialized = objectMapper.readValue(event.getPayload(), TestPayload.class);
        assertEquals("test-value", deserialized.name());
        assertEquals(123, deserialized.value());

        printSuccess("Outbox event created with correct data");
    }

    @Test
    @DisplayName("Saving outside a transaction is refused")
    void testSaveEvent_RequiresTransaction() {
        printTestHeader("Save Event - Requires Transaction");

        assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.saveEvent("JournalEntry", UUID.randomUUID(), "TestEvent", new TestPayload("x", 1)));

        printSuccess("Event without transaction refused");
    }

    @Test
    @DisplayName("Event should be marked as published")
    void testMarkPublished() {
        printTestHeader("Mark Event as Published");

        postSale(100);
        List<OutboxEvent> unpublished = outboxService.findUnpublishedEvents(50, MAX_RETRIES);
        assertFalse(unpublished.isEmpty());
        OutboxEvent event = unpublished.get(0);

        outboxService.markPublished(event.getId());

        boolean stillUnpublished = outboxService.findUnpublishedEvents(50, MAX_RETRIES).stream()
            .anyMatch(e -> e.getId().equals(event.getId()));
        assertFalse(stillUnpublished, "Event should no longer be in unpublished list");

        printSuccess("Event marked as published");
    }

    @Test
    @DisplayName("Failed event should increment retry count")
    void testMarkFailed_IncrementsRetryCount() {
        printTestHeader("Mark Event as Failed - Increments Retry Count");

        postSale(100);
        OutboxEvent event = outboxService.findUnpublishedEvents(50, MAX_RETRIES).get(0);

        outboxService.markFailed(event.getId(), "Connection timeout");
        outboxService.markFailed(event.getId(), "Kafka unavailable");
        int retries = outboxService.markFailed(event.getId(), "Broker not available");

        OutboxEventEntity entity = outboxEventRepository.findById(event.getId()).orElseThrow();
        printOutput("Retry count", entity.getRetryCount());
        assertEquals(3, retries);
        assertEquals(3, entity.getRetryCount());
        assertEquals("Broker not available", entity.getLastError());
        assertEquals(0, outboxService.markFailed(UUID.randomUUID(), "gone"));

        printSuccess("Failed event retry count incremented");
    }

    @Test
    @DisplayName("JournalEntryPosted and FiscalPeriodClosed carry ledger data")
    void testDomainEvents_Payloads() throws Exception {
        printTestHeader("Domain Events - Payloads");

        JournalEntry posted = postSale(2_500);
        periodService.closePeriod(january.getId(), "controller");

        OutboxEvent postedEvent = outboxService.getEventsOfType(JournalEntryPostedEvent.EVENT_TYPE).get(0);
        JsonNode postedPayload = objectMapper.readTree(postedEvent.getPayload());
        assertEquals(posted.getId(), postedEvent.getAggregateId());
        assertEquals(posted.getId().toString(), postedPayload.get("entryId").asText());
        assertEquals(2_500L, postedPayload.get("totalAmount").asLong());
        assertEquals(2, postedPayload.get("lineCount").asInt());

        OutboxEvent closedEvent = outboxService.getEventsOfType(FiscalPeriodClosedEvent.EVENT_TYPE).get(0);
        JsonNode closedPayload = objectMapper.readTree(closedEvent.getPayload());
        printOutput("Closed payload", closedPayload);
        assertEquals(january.getId(), closedEvent.getAggregateId());
        assertEquals(2_500L, closedPayload.get("totalDebits").asLong());
        assertEquals(2_500L, closedPayload.get("totalCredits").asLong());

        printSuccess("Domain events carry ledger data");
    }

    @Test
    @DisplayName("Count unpublished events for monitoring")
    void testCountUnpublished() {
        printTestHeader("Count Unpublished Events");

        long initial = outboxService.countUnpublished();
        postSale(10);
        postSale(20);

        // each post: created audit, posted audit, posted event
        assertEquals(initial + 6, outboxService.countUnpublished());

        printSuccess("Unpublished event count works");
    }

    record TestPayload(String name, int value) {}
}
