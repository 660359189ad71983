package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JournalEntryRequestTest {

    private static final LocalDate DATE = LocalDate.of(2026, 1, 15);
    private final UUID cash = UUID.randomUUID();
    private final UUID sales = UUID.randomUUID();

    private JournalEntryRequest request(JournalEntryRequest.Line... lines) {
        return new JournalEntryRequest(DATE, "Cash sale", "INV-1", JournalEntryType.MANUAL, "tester", List.of(lines));
    }

    @Test
    @DisplayName("Balanced two-line entry is valid")
    void testValidate_Balanced() {
        JournalEntryRequest request = request(
            JournalEntryRequest.Line.debit(cash, 100, null),
            JournalEntryRequest.Line.credit(sales, 100, null));

        assertDoesNotThrow(request::validate);
        assertEquals(100, request.getDebitTotal());
        assertEquals(100, request.getCreditTotal());
        assertTrue(request.isBalanced());
    }

    @Test
    @DisplayName("Unbalanced entry is rejected with no tolerance")
    void testValidate_Unbalanced() {
        JournalEntryRequest request = request(
            JournalEntryRequest.Line.debit(cash, 100, null),
            JournalEntryRequest.Line.credit(sales, 90, null));

        ValidationException e = assertThrows(ValidationException.class, request::validate);
        assertTrue(e.getMessage().contains("debits=100"));
        assertTrue(e.getMessage().contains("credits=90"));
    }

    @Test
    @DisplayName("Off by one minor unit is still unbalanced")
    void testValidate_OffByOne() {
        JournalEntryRequest request = request(
            JournalEntryRequest.Line.debit(cash, 1_000_000_001L, null),
            JournalEntryRequest.Line.credit(sales, 1_000_000_000L, null));

        assertThrows(ValidationException.class, request::validate);
    }

    @Test
    @DisplayName("Single line, zero and negative amounts are rejected")
    void testValidate_LineRules() {
        assertThrows(ValidationException.class,
            () -> request(JournalEntryRequest.Line.debit(cash, 100, null)).validate());
        assertThrows(ValidationException.class, () -> request(
            JournalEntryRequest.Line.debit(cash, 0, null),
            JournalEntryRequest.Line.credit(sales, 0, null)).validate());
        assertThrows(ValidationException.class, () -> request(
            JournalEntryRequest.Line.debit(cash, -5, null),
            JournalEntryRequest.Line.credit(sales, -5, null)).validate());
    }

    @Test
    @DisplayName("Entry needs both a debit and a credit line")
    void testValidate_OneSided() {
        JournalEntryRequest request = request(
            JournalEntryRequest.Line.debit(cash, 50, null),
            JournalEntryRequest.Line.debit(sales, 50, null));

        assertThrows(ValidationException.class, request::validate);
    }

    @Test
    @DisplayName("Overflowing totals are a validation error, not a wrapped sum")
    void testValidate_Overflow() {
        JournalEntryRequest request = request(
            JournalEntryRequest.Line.debit(cash, Long.MAX_VALUE, null),
            JournalEntryRequest.Line.debit(cash, 1, null),
            JournalEntryRequest.Line.credit(sales, 1, null));

        assertThrows(ValidationException.class, request::validate);
    }

    @Test
    @DisplayName("Required header fields are checked")
    void testValidate_RequiredFields() {
        List<JournalEntryRequest.Line> lines = List.of(
            JournalEntryRequest.Line.debit(cash, 10, null),
            JournalEntryRequest.Line.credit(sales, 10, null));

        assertThrows(ValidationException.class,
            () -> new JournalEntryRequest(null, "x", null, JournalEntryType.MANUAL, "tester", lines).validate());
        assertThrows(ValidationException.class,
            () -> new JournalEntryRequest(DATE, " ", null, JournalEntryType.MANUAL, "tester", lines).validate());
        assertThrows(ValidationException.class,
            () -> new JournalEntryRequest(DATE, "x", null, null, "tester", lines).validate());
        assertThrows(ValidationException.class,
            () -> new JournalEntryRequest(DATE, "x", null, JournalEntryType.MANUAL, null, lines).validate());
    }

    @Test
    @DisplayName("Account IDs are listed once each")
    void testAccountIds_Distinct() {
        JournalEntryRequest request = request(
            JournalEntryRequest.Line.debit(cash, 60, null),
            JournalEntryRequest.Line.debit(cash, 40, null),
            JournalEntryRequest.Line.credit(sales, 100, null));

        assertEquals(List.of(cash, sales), request.accountIds());
    }
}
