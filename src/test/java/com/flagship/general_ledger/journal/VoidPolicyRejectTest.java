package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.AbstractIntegrationTest;
import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.exception.PeriodClosedException;
import com.flagship.general_ledger.period.FiscalPeriod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.context.TestPropertySource;

import java.time.LocalDate;

import static com.flagship.general_ledger.journal.JournalEntryRequest.Line.credit;
import static com.flagship.general_ledger.journal.JournalEntryRequest.Line.debit;
import static org.junit.jupiter.api.Assertions.*;

@TestPropertySource(properties = "ledger.journal.void-in-closed-period=REJECT")
class VoidPolicyRejectTest extends AbstractIntegrationTest {

    @Test
    @DisplayName("REJECT policy refuses voids in CLOSED periods until reopened")
    void testVoidEntry_ClosedPeriodRejected() {
        printTestHeader("Void Entry - Closed Period Rejected");

        Account cash = createAccount("1100", "Cash", AccountType.ASSET);
        Account sales = createAccount("4100", "Sales", AccountType.REVENUE);
        FiscalPeriod january = openPeriod(2026, 1);
        JournalEntry posted = createAndPost(LocalDate.of(2026, 1, 10), "Sale",
            debit(cash.getId(), 900, null), credit(sales.getId(), 900, null));
        periodService.closePeriod(january.getId(), "controller");

        // When: the period is CLOSED
        assertEquals(VoidPolicy.REJECT, journalEntryService.getVoidPolicy());
        assertThrows(PeriodClosedException.class,
            () -> journalEntryService.voidEntry(posted.getId(), "Customer cancelled", "controller"));
        assertEquals(JournalEntryStatus.POSTED, journalEntryService.getEntry(posted.getId()).getStatus());

        // Then: reopening makes the void possible
        periodService.reopenPeriod(january.getId(), "Customer cancellation found in audit", "controller");
        JournalEntry voided = journalEntryService.voidEntry(posted.getId(), "Customer cancelled", "controller");
        assertEquals(JournalEntryStatus.VOIDED, voided.getStatus());

        printSuccess("Void rejected while CLOSED, accepted after reopen");
    }
}
