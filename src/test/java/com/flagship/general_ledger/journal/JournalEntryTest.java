package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JournalEntryTest {

    private JournalEntry draft() {
        JournalEntryRequest request = new JournalEntryRequest(
            LocalDate.of(2026, 3, 31), "  Month-end accrual ", "ACC-3", JournalEntryType.ADJUSTING, "tester",
            List.of(
                JournalEntryRequest.Line.debit(UUID.randomUUID(), 2_500, "expense"),
                JournalEntryRequest.Line.credit(UUID.randomUUID(), 2_500, "accrual")));
        return JournalEntry.draft(UUID.randomUUID(), JournalEntry.formatEntryNumber(2026, 42), request);
    }

    @Test
    @DisplayName("Draft gets numbered lines and its fiscal period from the entry date")
    void testDraft() {
        JournalEntry entry = draft();

        assertEquals("JE-2026-000042", entry.getEntryNumber());
        assertEquals(JournalEntryStatus.DRAFT, entry.getStatus());
        assertEquals("Month-end accrual", entry.getDescription());
        assertEquals(2026, entry.getFiscalYear());
        assertEquals(3, entry.getFiscalMonth());
        assertEquals(2, entry.getLines().size());
        assertEquals(1, entry.getLines().get(0).getLineNumber());
        assertEquals(2, entry.getLines().get(1).getLineNumber());
        assertEquals(entry.getId(), entry.getLines().get(0).getEntryId());
        assertEquals(2_500, entry.getDebitTotal());
        assertEquals(2_500, entry.getCreditTotal());
    }

    @Test
    @DisplayName("DRAFT -> POSTED -> VOIDED")
    void testLifecycle() {
        JournalEntry posted = draft().post("controller");
        assertEquals(JournalEntryStatus.POSTED, posted.getStatus());
        assertEquals("controller", posted.getPostedBy());
        assertNotNull(posted.getPostedAt());

        JournalEntry voided = posted.voidEntry("  duplicate  ", "controller");
        assertEquals(JournalEntryStatus.VOIDED, voided.getStatus());
        assertEquals("duplicate", voided.getVoidReason());
        assertNotNull(voided.getVoidedAt());
    }

    @Test
    @DisplayName("Posting twice is an invalid state")
    void testPost_AlreadyPosted() {
        JournalEntry posted = draft().post("controller");
        assertThrows(InvalidStateException.class, () -> posted.post("controller"));
    }

    @Test
    @DisplayName("Only POSTED entries can be voided, and never re-posted")
    void testVoid_Rules() {
        JournalEntry draft = draft();
        assertThrows(InvalidStateException.class, () -> draft.voidEntry("wrong amount", "controller"));

        JournalEntry voided = draft.post("controller").voidEntry("wrong amount", "controller");
        assertThrows(InvalidStateException.class, () -> voided.post("controller"));
        assertThrows(InvalidStateException.class, () -> voided.voidEntry("again", "controller"));
    }

    @Test
    @DisplayName("Void reason must be at least 3 characters")
    void testVoid_ShortReason() {
        JournalEntry posted = draft().post("controller");
        assertThrows(ValidationException.class, () -> posted.voidEntry("no", "controller"));
        assertThrows(ValidationException.class, () -> posted.voidEntry(null, "controller"));
    }

    @Test
    @DisplayName("Posting re-checks the balance of the stored lines")
    void testPost_UnbalancedLines() {
        JournalEntry entry = draft();
        JournalEntry corrupted = entry.toBuilder().lines(List.of(entry.getLines().get(0))).build();

        assertThrows(ValidationException.class, () -> corrupted.post("controller"));
    }
}
