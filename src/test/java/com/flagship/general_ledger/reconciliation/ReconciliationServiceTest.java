package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.AbstractIntegrationTest;
import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.NotReconciledException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.journal.Direction;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryStatus;
import com.flagship.general_ledger.journal.JournalEntryType;
import com.flagship.general_ledger.journal.JournalLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static com.flagship.general_ledger.journal.JournalEntryRequest.Line.credit;
import static com.flagship.general_ledger.journal.JournalEntryRequest.Line.debit;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Bank reconciliation from statement import to approval.
 */
class ReconciliationServiceTest extends AbstractIntegrationTest {

    private static final LocalDate JAN_5 = LocalDate.of(2026, 1, 5);
    private static final LocalDate JAN_31 = LocalDate.of(2026, 1, 31);

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private BankAccountService bankAccountService;

    private Account bankGl;
    private Account sales;
    private Account bankFees;
    private Account interestIncome;
    private BankAccount bankAccount;

    @BeforeEach
    void setUp() {
        bankGl = createAccount("1010", "Operating Bank", AccountType.ASSET);
        sales = createAccount("4100", "Sales", AccountType.REVENUE);
        bankFees = createAccount("6500", "Bank Fees", AccountType.EXPENSE);
        interestIncome = createAccount("4900", "Interest Income", AccountType.REVENUE);
        openPeriod(2026, 1);
        bankAccount = bankAccountService.createBankAccount(bankGl.getId(), "First National", "000123456", null);
    }

    private StatementLine statementLine(LocalDate date, long amount, String reference) {
        return new StatementLine(date, "Statement line " + reference, amount, reference);
    }

    private BankTransaction transactionWithReference(UUID reconciliationId, String reference) {
        return reconciliationService.getTransactions(reconciliationId).stream()
            .filter(t -> reference.equals(t.getReference()))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No bank transaction with reference " + reference));
    }

    @Test
    @DisplayName("Deposit of 25,000,000 auto-matches the same-day debit and the month reconciles")
    void testAutoMatch_FullCycle() {
        printTestHeader("Auto Match - Full Cycle");

        // Given
        createAndPost(JAN_5, "Customer deposit",
            debit(bankGl.getId(), 25_000_000L, null), credit(sales.getId(), 25_000_000L, null));
        Reconciliation reconciliation = reconciliationService.createReconciliation(
            bankAccount.getId(), 2026, 1, 25_000_000L, null, "clerk");
        printInput("Book ending balance", reconciliation.getBookEndingBalance());
        assertEquals(25_000_000L, reconciliation.getBookEndingBalance());
        assertEquals(ReconciliationStatus.DRAFT, reconciliation.getStatus());

        ImportResult imported = reconciliationService.importStatement(reconciliation.getId(), List.of(
            statementLine(JAN_5, 25_000_000L, "DEP-001"),
            statementLine(JAN_5, 25_000_000L, "DEP-001")), "clerk");
        assertEquals(1, imported.getImported());
        assertEquals(1, imported.getDuplicatesSkipped());
        assertEquals(ReconciliationStatus.IN_PROGRESS,
            reconciliationService.getReconciliation(reconciliation.getId()).getStatus());

        // When
        AutoMatchResult result = reconciliationService.autoMatch(reconciliation.getId(), null, "clerk");

        // Then
        printOutput("Matched", result.getMatchedCount());
        printOutput("Unmatched", result.getUnmatchedCount());
        assertEquals(1, result.getMatchedCount());
        assertEquals(0, result.getUnmatchedCount());
        assertEquals(MatchStatus.MATCHED, transactionWithReference(reconciliation.getId(), "DEP-001").getMatchStatus());

        AdjustedBalances balances = reconciliationService.calculate(reconciliation.getId());
        assertTrue(balances.isReconciled());

        Reconciliation completed = reconciliationService.complete(reconciliation.getId(), "clerk");
        assertEquals(ReconciliationStatus.COMPLETED, completed.getStatus());
        Reconciliation approved = reconciliationService.approve(reconciliation.getId(), "controller");
        assertEquals(ReconciliationStatus.APPROVED, approved.getStatus());

        BankAccount updated = bankAccountService.getBankAccount(bankAccount.getId());
        assertEquals(2026, updated.getLastReconciledYear());
        assertEquals(1, updated.getLastReconciledMonth());
        assertEquals(25_000_000L, updated.getLastReconciledBalance());

        printSuccess("Statement matched, reconciled and approved");
    }

    @Test
    @DisplayName("Outstanding check of 5,000,000 is needed before completion")
    void testComplete_OutstandingCheck() {
        printTestHeader("Complete - Outstanding Check");

        Reconciliation reconciliation = reconciliationService.createReconciliation(
            bankAccount.getId(), 2026, 1, 105_000_000L, 100_000_000L, "clerk");

        NotReconciledException ex = assertThrows(NotReconciledException.class,
            () -> reconciliationService.complete(reconciliation.getId(), "clerk"));
        printOutput("Error", ex.getMessage());
        assertFalse(reconciliationService.calculate(reconciliation.getId()).isReconciled());

        reconciliationService.addReconcilingItem(reconciliation.getId(), ReconcilingItemType.OUTSTANDING_CHECK,
            "Check 1042 to landlord", 5_000_000L, LocalDate.of(2026, 1, 29), "CHK-1042", null, null, "clerk");

        AdjustedBalances balances = reconciliationService.calculate(reconciliation.getId());
        assertTrue(balances.isReconciled());
        assertEquals(100_000_000L, balances.getAdjustedBankBalance());
        assertEquals(100_000_000L,
            reconciliationService.getReconciliation(reconciliation.getId()).getAdjustedBankBalance());

        Reconciliation completed = reconciliationService.complete(reconciliation.getId(), "clerk");
        assertEquals(ReconciliationStatus.COMPLETED, completed.getStatus());

        // Finished reconciliations are read-only
        assertThrows(InvalidStateException.class, () -> reconciliationService.importStatement(
            reconciliation.getId(), List.of(statementLine(JAN_31, 10, "LATE")), "clerk"));
        assertThrows(InvalidStateException.class, () -> reconciliationService.addReconcilingItem(
            reconciliation.getId(), ReconcilingItemType.ADJUSTMENT, "Rounding", 1, JAN_31, null, null, null, "clerk"));

        printSuccess("Completed once the check was accounted for");
    }

    @Test
    @DisplayName("Bank fee and interest become adjusting entries and explain their statement lines")
    void testAdjustingEntries() {
        printTestHeader("Adjusting Entries");

        createAndPost(JAN_5, "Customer deposit",
            debit(bankGl.getId(), 1_000_000L, null), credit(sales.getId(), 1_000_000L, null));
        Reconciliation reconciliation = reconciliationService.createReconciliation(
            bankAccount.getId(), 2026, 1, 997_900L, null, "clerk");
        reconciliationService.importStatement(reconciliation.getId(), List.of(
            statementLine(JAN_5, 1_000_000L, "DEP"),
            statementLine(JAN_31, -2_500L, "FEE"),
            statementLine(JAN_31, 400L, "INT")), "clerk");

        AutoMatchResult matched = reconciliationService.autoMatch(reconciliation.getId(), 3, "clerk");
        assertEquals(1, matched.getMatchedCount());
        assertEquals(2, matched.getUnmatchedCount());
        assertThrows(NotReconciledException.class,
            () -> reconciliationService.complete(reconciliation.getId(), "clerk"));

        UUID feeTransaction = transactionWithReference(reconciliation.getId(), "FEE").getId();
        UUID interestTransaction = transactionWithReference(reconciliation.getId(), "INT").getId();
        reconciliationService.addReconcilingItem(reconciliation.getId(), ReconcilingItemType.BANK_FEE,
            "Monthly service fee", 2_500L, JAN_31, "FEE", null, feeTransaction, "clerk");
        reconciliationService.addReconcilingItem(reconciliation.getId(), ReconcilingItemType.BANK_INTEREST,
            "Interest credited", 400L, JAN_31, "INT", null, interestTransaction, "clerk");
        assertThrows(InvalidStateException.class, () -> reconciliationService.addReconcilingItem(
            reconciliation.getId(), ReconcilingItemType.BANK_FEE, "Same fee again", 2_500L, JAN_31, "FEE",
            null, feeTransaction, "clerk"));

        AdjustedBalances balances = reconciliationService.calculate(reconciliation.getId());
        printOutput("Adjusted book", balances.getAdjustedBookBalance());
        assertEquals(997_900L, balances.getAdjustedBookBalance());
        assertTrue(balances.isReconciled());

        // When
        List<JournalEntry> entries = reconciliationService.createAdjustingEntries(reconciliation.getId(),
            new AdjustingEntryAccounts(bankFees.getId(), interestIncome.getId(), null), "clerk");

        // Then
        assertEquals(2, entries.size());
        entries.forEach(entry -> {
            assertEquals(JournalEntryType.ADJUSTING, entry.getEntryType());
            assertEquals(JournalEntryStatus.DRAFT, entry.getStatus());
            assertEquals(JAN_31, entry.getEntryDate());
        });
        JournalLine feeDebit = entries.stream()
            .flatMap(entry -> entry.getLines().stream())
            .filter(l -> l.getDirection() == Direction.DEBIT && l.getAccountId().equals(bankFees.getId()))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No fee expense debit"));
        assertEquals(2_500L, feeDebit.getAmount());
        JournalLine interestDebit = entries.stream()
            .flatMap(entry -> entry.getLines().stream())
            .filter(l -> l.getDirection() == Direction.DEBIT && l.getAccountId().equals(bankGl.getId()))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No bank debit for interest"));
        assertEquals(400L, interestDebit.getAmount());

        assertTrue(reconciliationService.getItems(reconciliation.getId()).stream()
            .noneMatch(ReconcilingItem::needsAdjustingEntry));
        assertTrue(reconciliationService.createAdjustingEntries(reconciliation.getId(),
            new AdjustingEntryAccounts(bankFees.getId(), interestIncome.getId(), null), "clerk").isEmpty());

        Reconciliation completed = reconciliationService.complete(reconciliation.getId(), "clerk");
        assertEquals(ReconciliationStatus.COMPLETED, completed.getStatus());

        printSuccess("Adjusting entries drafted and reconciliation completed");
    }

    @Test
    @DisplayName("Manual match checks the line and keeps matches one to one")
    void testManualMatch() {
        printTestHeader("Manual Match");

        JournalEntry deposit = createAndPost(JAN_5, "Customer deposit",
            debit(bankGl.getId(), 3_000L, null), credit(sales.getId(), 3_000L, null));
        JournalEntry draft = createEntry(JAN_5, "Unposted deposit",
            debit(bankGl.getId(), 3_000L, null), credit(sales.getId(), 3_000L, null));
        UUID bankLine = deposit.getLines().stream()
            .filter(l -> l.getAccountId().equals(bankGl.getId())).findFirst().orElseThrow().getId();
        UUID salesLine = deposit.getLines().stream()
            .filter(l -> l.getAccountId().equals(sales.getId())).findFirst().orElseThrow().getId();

        Reconciliation reconciliation = reconciliationService.createReconciliation(
            bankAccount.getId(), 2026, 1, 3_000L, null, "clerk");
        reconciliationService.importStatement(reconciliation.getId(), List.of(
            statementLine(JAN_5, 3_000L, "A"),
            statementLine(LocalDate.of(2026, 1, 6), 3_000L, "B")), "clerk");
        UUID first = transactionWithReference(reconciliation.getId(), "A").getId();
        UUID second = transactionWithReference(reconciliation.getId(), "B").getId();

        assertThrows(ValidationException.class, () -> reconciliationService.matchTransaction(
            reconciliation.getId(), first, draft.getLines().get(0).getId(), "clerk"));
        assertThrows(ValidationException.class, () -> reconciliationService.matchTransaction(
            reconciliation.getId(), first, salesLine, "clerk"));

        BankTransaction matched = reconciliationService.matchTransaction(reconciliation.getId(), first, bankLine, "clerk");
        assertEquals(MatchStatus.MATCHED, matched.getMatchStatus());
        assertEquals(bankLine, matched.getMatchedJournalLineId());

        assertThrows(InvalidStateException.class, () -> reconciliationService.matchTransaction(
            reconciliation.getId(), first, bankLine, "clerk"));
        assertThrows(InvalidStateException.class, () -> reconciliationService.matchTransaction(
            reconciliation.getId(), second, bankLine, "clerk"));

        BankTransaction unmatched = reconciliationService.unmatchTransaction(reconciliation.getId(), first, "clerk");
        assertEquals(MatchStatus.UNMATCHED, unmatched.getMatchStatus());
        assertNull(unmatched.getMatchedJournalLineId());
        assertThrows(InvalidStateException.class,
            () -> reconciliationService.unmatchTransaction(reconciliation.getId(), first, "clerk"));

        printSuccess("Manual matching rules enforced");
    }

    @Test
    @DisplayName("A statement line explained by a reconciling item is never matched to a journal line")
    void testMatch_TransactionExplainedByItem() {
        printTestHeader("Match - Transaction Explained By Item");

        // Given
        JournalEntry deposit = createAndPost(JAN_5, "Customer deposit",
            debit(bankGl.getId(), 3_000L, null), credit(sales.getId(), 3_000L, null));
        UUID bankLine = deposit.getLines().stream()
            .filter(l -> l.getAccountId().equals(bankGl.getId())).findFirst().orElseThrow().getId();
        Reconciliation reconciliation = reconciliationService.createReconciliation(
            bankAccount.getId(), 2026, 1, 3_000L, null, "clerk");
        reconciliationService.importStatement(reconciliation.getId(), List.of(
            statementLine(JAN_5, 3_000L, "DEP")), "clerk");
        UUID transaction = transactionWithReference(reconciliation.getId(), "DEP").getId();
        reconciliationService.addReconcilingItem(reconciliation.getId(), ReconcilingItemType.BANK_INTEREST,
            "Credited by the bank", 3_000L, JAN_5, "DEP", null, transaction, "clerk");

        // When
        InvalidStateException ex = assertThrows(InvalidStateException.class, () ->
            reconciliationService.matchTransaction(reconciliation.getId(), transaction, bankLine, "clerk"));
        AutoMatchResult result = reconciliationService.autoMatch(reconciliation.getId(), 3, "clerk");

        // Then
        printOutput("Error", ex.getMessage());
        printOutput("Auto-matched", result.getMatchedCount());
        assertEquals(0, result.getMatchedCount());
        assertEquals(0, result.getUnmatchedCount());
        BankTransaction stored = transactionWithReference(reconciliation.getId(), "DEP");
        assertEquals(MatchStatus.UNMATCHED, stored.getMatchStatus());
        assertNull(stored.getMatchedJournalLineId());

        printSuccess("Explained statement line stayed out of matching");
    }

    @Test
    @DisplayName("One reconciliation per bank account and month, on active asset accounts only")
    void testCreateReconciliation_Rules() {
        printTestHeader("Create Reconciliation - Rules");

        reconciliationService.createReconciliation(bankAccount.getId(), 2026, 1, 0L, 0L, "clerk");
        assertThrows(InvalidStateException.class, () -> reconciliationService.createReconciliation(
            bankAccount.getId(), 2026, 1, 0L, 0L, "clerk"));

        assertThrows(ValidationException.class,
            () -> bankAccountService.createBankAccount(sales.getId(), "First National", "999", "USD"));

        bankAccountService.changeStatus(bankAccount.getId(), BankAccountStatus.INACTIVE);
        assertThrows(InvalidStateException.class, () -> reconciliationService.createReconciliation(
            bankAccount.getId(), 2026, 2, 0L, 0L, "clerk"));

        printSuccess("Reconciliation creation rules enforced");
    }
}
