package com.flagship.general_ledger.period;

import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class FiscalPeriodTest {

    @Test
    @DisplayName("New period is OPEN and spans its calendar month")
    void testCreate() {
        FiscalPeriod period = FiscalPeriod.create(2024, 2);

        assertEquals(FiscalPeriodStatus.OPEN, period.getStatus());
        assertTrue(period.acceptsPostings());
        assertEquals(LocalDate.of(2024, 2, 1), period.startDate());
        assertEquals(LocalDate.of(2024, 2, 29), period.endDate());
        assertEquals("2024-02", period.label());
    }

    @Test
    @DisplayName("Year before 1900 and month outside 1-12 are rejected")
    void testCreate_InvalidYearMonth() {
        assertThrows(ValidationException.class, () -> FiscalPeriod.create(1899, 1));
        assertThrows(ValidationException.class, () -> FiscalPeriod.create(2026, 0));
        assertThrows(ValidationException.class, () -> FiscalPeriod.create(2026, 13));
    }

    @Test
    @DisplayName("OPEN -> CLOSED -> OPEN -> CLOSED -> LOCKED")
    void testLifecycle() {
        FiscalPeriod closed = FiscalPeriod.create(2026, 1).close("controller");
        assertEquals(FiscalPeriodStatus.CLOSED, closed.getStatus());
        assertFalse(closed.acceptsPostings());

        FiscalPeriod reopened = closed.reopen("late supplier invoice", "controller");
        assertEquals(FiscalPeriodStatus.OPEN, reopened.getStatus());
        assertEquals("late supplier invoice", reopened.getReopenReason());

        FiscalPeriod locked = reopened.close("controller").lock("cfo");
        assertEquals(FiscalPeriodStatus.LOCKED, locked.getStatus());
        assertEquals("cfo", locked.getLockedBy());
    }

    @Test
    @DisplayName("LOCKED period can never be reopened")
    void testReopen_Locked() {
        FiscalPeriod locked = FiscalPeriod.create(2026, 1).close("controller").lock("cfo");

        assertThrows(InvalidStateException.class, () -> locked.reopen("need to fix an entry", "controller"));
        assertThrows(InvalidStateException.class, () -> locked.close("controller"));
    }

    @Test
    @DisplayName("Reopen needs a CLOSED period and a 10-character reason")
    void testReopen_Rules() {
        FiscalPeriod open = FiscalPeriod.create(2026, 1);
        assertThrows(InvalidStateException.class, () -> open.reopen("need to fix an entry", "controller"));

        FiscalPeriod closed = open.close("controller");
        assertThrows(ValidationException.class, () -> closed.reopen("too short", "controller"));
    }

    @Test
    @DisplayName("Only CLOSED periods can be locked")
    void testLock_RequiresClosed() {
        assertThrows(InvalidStateException.class, () -> FiscalPeriod.create(2026, 1).lock("cfo"));
    }
}
