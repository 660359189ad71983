package com.flagship.general_ledger.period;

import com.flagship.general_ledger.AbstractIntegrationTest;
import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.event.FiscalPeriodClosedEvent;
import com.flagship.general_ledger.exception.DuplicatePeriodException;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.UnbalancedPeriodException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;

import static com.flagship.general_ledger.journal.JournalEntryRequest.Line.credit;
import static com.flagship.general_ledger.journal.JournalEntryRequest.Line.debit;
import static org.junit.jupiter.api.Assertions.*;

class FiscalPeriodServiceTest extends AbstractIntegrationTest {

    @Autowired
    private OutboxService outboxService;

    private Account cash;
    private Account receivable;
    private Account payable;

    @BeforeEach
    void setUp() {
        cash = createAccount("1100", "Cash", AccountType.ASSET);
        receivable = createAccount("1200", "Accounts Receivable", AccountType.ASSET);
        payable = createAccount("2100", "Accounts Payable", AccountType.LIABILITY);
    }

    @Test
    @DisplayName("A month can only be created once")
    void testCreatePeriod_Duplicate() {
        printTestHeader("Create Period - Duplicate");

        FiscalPeriod period = openPeriod(2026, 2);
        assertEquals(FiscalPeriodStatus.OPEN, period.getStatus());
        assertEquals(LocalDate.of(2026, 2, 28), period.endDate());

        assertThrows(DuplicatePeriodException.class, () -> openPeriod(2026, 2));
        assertThrows(ValidationException.class, () -> openPeriod(2026, 13));
        assertEquals(1, countRows("fiscal_periods"));

        printSuccess("Duplicate month rejected");
    }

    @Test
    @DisplayName("Balanced period closes and records who closed it")
    void testClosePeriod_Balanced() {
        printTestHeader("Close Period - Balanced");

        FiscalPeriod january = openPeriod(2026, 1);
        createAndPost(LocalDate.of(2026, 1, 8), "AR collection",
            debit(cash.getId(), 60_000_000L, null), credit(receivable.getId(), 60_000_000L, null));
        createAndPost(LocalDate.of(2026, 1, 20), "AP payment",
            debit(payable.getId(), 150_000_000L, null), credit(cash.getId(), 150_000_000L, null));

        FiscalPeriod closed = periodService.closePeriod(january.getId(), "controller");

        printOutput("Status", closed.getStatus());
        assertEquals(FiscalPeriodStatus.CLOSED, closed.getStatus());
        assertEquals("controller", closed.getClosedBy());
        assertNotNull(closed.getClosedAt());
        assertEquals(3, countRows("account_balances"));
        assertEquals(1, outboxService.getEventsOfType(FiscalPeriodClosedEvent.EVENT_TYPE).size());

        printSuccess("Period closed");
    }

    @Test
    @DisplayName("Corrupted ledger leaves the period OPEN with an unbalanced error")
    void testClosePeriod_Unbalanced() {
        printTestHeader("Close Period - Unbalanced");

        FiscalPeriod january = openPeriod(2026, 1);
        createAndPost(LocalDate.of(2026, 1, 8), "AR collection",
            debit(cash.getId(), 60_000_000L, null), credit(receivable.getId(), 60_000_000L, null));
        JournalEntry payment = createAndPost(LocalDate.of(2026, 1, 20), "AP payment",
            debit(payable.getId(), 150_000_000L, null), credit(cash.getId(), 150_000_000L, null));

        // Given: one line removed behind the service's back
        jdbcTemplate.update("DELETE FROM journal_lines WHERE entry_id = ? AND direction = 'CREDIT'", payment.getId());

        // When
        UnbalancedPeriodException ex = assertThrows(UnbalancedPeriodException.class,
            () -> periodService.closePeriod(january.getId(), "controller"));
        printOutput("Error", ex.getMessage());

        // Then
        assertEquals(FiscalPeriodStatus.OPEN, periodService.getPeriod(january.getId()).getStatus());
        assertEquals(0, countRows("account_balances"));
        assertEquals(0, outboxService.getEventsOfType(FiscalPeriodClosedEvent.EVENT_TYPE).size());

        printSuccess("Unbalanced close rolled back");
    }

    @Test
    @DisplayName("Reopen needs a reason and LOCKED is final")
    void testReopenAndLock() {
        printTestHeader("Reopen and Lock");

        FiscalPeriod january = openPeriod(2026, 1);

        assertThrows(InvalidStateException.class, () -> periodService.lockPeriod(january.getId(), "auditor"));
        assertThrows(InvalidStateException.class,
            () -> periodService.reopenPeriod(january.getId(), "Reason long enough", "controller"));

        periodService.closePeriod(january.getId(), "controller");
        assertThrows(ValidationException.class,
            () -> periodService.reopenPeriod(january.getId(), "short", "controller"));

        FiscalPeriod reopened = periodService.reopenPeriod(january.getId(), "Missing supplier invoice", "controller");
        assertEquals(FiscalPeriodStatus.OPEN, reopened.getStatus());
        assertEquals("Missing supplier invoice", reopened.getReopenReason());

        periodService.closePeriod(january.getId(), "controller");
        FiscalPeriod locked = periodService.lockPeriod(january.getId(), "auditor");
        assertEquals(FiscalPeriodStatus.LOCKED, locked.getStatus());

        assertThrows(InvalidStateException.class,
            () -> periodService.reopenPeriod(january.getId(), "Auditor asked again", "controller"));
        assertThrows(InvalidStateException.class, () -> periodService.closePeriod(january.getId(), "controller"));

        printSuccess("Transitions enforced");
    }

    @Test
    @DisplayName("Close checklist reports drafts and an open previous month")
    void testCloseChecklist() {
        printTestHeader("Close Checklist");

        openPeriod(2026, 1);
        FiscalPeriod february = openPeriod(2026, 2);
        createEntry(LocalDate.of(2026, 2, 3), "Draft collection",
            debit(cash.getId(), 1_000, null), credit(receivable.getId(), 1_000, null));

        CloseChecklist checklist = periodService.closeChecklist(february.getId());
        printOutput("Warnings", checklist.getWarnings());
        printOutput("Blockers", checklist.getBlockers());

        assertTrue(checklist.isReadyToClose());
        assertTrue(checklist.isTrialBalanceBalanced());
        assertEquals(1, checklist.getDraftEntryCount());
        assertEquals(FiscalPeriodStatus.OPEN, checklist.getPreviousPeriodStatus());
        assertEquals(2, checklist.getWarnings().size());

        periodService.closePeriod(february.getId(), "controller");
        CloseChecklist afterClose = periodService.closeChecklist(february.getId());
        assertFalse(afterClose.isReadyToClose());
        assertEquals(1, afterClose.getBlockers().size());

        printSuccess("Checklist reflects period state");
    }
}
