package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.audit.AuditLogSink;
import com.flagship.general_ledger.audit.AuditRecord;
import com.flagship.general_ledger.balance.AccountBalanceService;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryRepository;
import com.flagship.general_ledger.journal.JournalEntryRequest;
import com.flagship.general_ledger.journal.JournalEntryService;
import com.flagship.general_ledger.journal.JournalEntryType;
import com.flagship.general_ledger.journal.PostedLine;
import com.flagship.general_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Bank statement reconciliation.
 *
 * Every mutation locks the reconciliation row first, so operations on one
 * reconciliation run one at a time.
 */
@Service
@Slf4j
public class ReconciliationService {

    static final String ENTITY_TYPE = "Reconciliation";

    private final ReconciliationRepository reconciliationRepository;
    private final BankAccountService bankAccountService;
    private final AccountBalanceService balanceService;
    private final JournalEntryRepository entryRepository;
    private final JournalEntryService journalEntryService;
    private final AutoMatcher autoMatcher;
    private final AuditLogSink auditLogSink;
    private final LedgerMetrics metrics;
    private final int defaultDateToleranceDays;

    public ReconciliationService(ReconciliationRepository reconciliationRepository,
                                 BankAccountService bankAccountService,
                                 AccountBalanceService balanceService,
                                 JournalEntryRepository entryRepository,
                                 JournalEntryService journalEntryService,
                                 AutoMatcher autoMatcher,
                                 AuditLogSink auditLogSink,
                                 LedgerMetrics metrics,
                                 @Value("${ledger.reconciliation.default-date-tolerance-days:3}") int defaultDateToleranceDays) {
        this.reconciliationRepository = reconciliationRepository;
        this.bankAccountService = bankAccountService;
        this.balanceService = balanceService;
        this.entryRepository = entryRepository;
        this.journalEntryService = journalEntryService;
        this.autoMatcher = autoMatcher;
        this.auditLogSink = auditLogSink;
        this.metrics = metrics;
        this.defaultDateToleranceDays = defaultDateToleranceDays;
    }

    /**
     * @param bookEndingBalance null to take the linked GL account's posted balance at month end
     * @throws InvalidStateException if the bank account is not ACTIVE or the month is already being reconciled
     */
    @Transactional
    public Reconciliation createReconciliation(UUID bankAccountId, int fiscalYear, int fiscalMonth,
                                               long statementEndingBalance, Long bookEndingBalance,
                                               String createdBy) {
        BankAccount bankAccount = bankAccountService.getBankAccount(bankAccountId);
        if (!bankAccount.isActive()) {
            throw new InvalidStateException(String.format(
                "Bank account %s is %s", bankAccount.getAccountNumber(), bankAccount.getStatus()));
        }
        if (reconciliationRepository.existsForPeriod(bankAccountId, fiscalYear, fiscalMonth)) {
            throw new InvalidStateException(String.format(
                "Reconciliation already exists for bank account %s in %d-%02d",
                bankAccount.getAccountNumber(), fiscalYear, fiscalMonth));
        }

        Reconciliation draft = Reconciliation.create(bankAccountId, fiscalYear, fiscalMonth,
            statementEndingBalance, 0L, createdBy);
        long book = bookEndingBalance != null
            ? bookEndingBalance
            : balanceService.bookBalanceAsOf(bankAccount.getLinkedAccountId(), draft.yearMonth().atEndOfMonth());
        Reconciliation reconciliation = draft.toBuilder().bookEndingBalance(book).build();

        try {
            reconciliationRepository.insert(reconciliation);
        } catch (DuplicateKeyException e) {
            throw new InvalidStateException("Reconciliation already exists for " + reconciliation.label());
        }

        auditLogSink.record(AuditRecord.of("RECONCILIATION_CREATED", ENTITY_TYPE, reconciliation.getId(), null,
            AuditRecord.values(
                "bankAccountId", bankAccountId,
                "period", reconciliation.label(),
                "statementEndingBalance", statementEndingBalance,
                "bookEndingBalance", book)));

        log.info("Reconciliation created: bankAccount={}, period={}, statement={}, book={}",
            bankAccount.getAccountNumber(), reconciliation.label(), statementEndingBalance, book);
        return reconciliation;
    }

    @Transactional(readOnly = true)
    public Reconciliation getReconciliation(UUID reconciliationId) {
        return reconciliationRepository.findById(reconciliationId)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, reconciliationId));
    }

    @Transactional(readOnly = true)
    public List<Reconciliation> listForBankAccount(UUID bankAccountId) {
        bankAccountService.getBankAccount(bankAccountId);
        return reconciliationRepository.findByBankAccount(bankAccountId);
    }

    @Transactional(readOnly = true)
    public List<BankTransaction> getTransactions(UUID reconciliationId) {
        return reconciliationRepository.findTransactions(reconciliationId);
    }

    @Transactional(readOnly = true)
    public List<ReconcilingItem> getItems(UUID reconciliationId) {
        return reconciliationRepository.findItems(reconciliationId);
    }

    /**
     * Adds statement lines, skipping ones already imported (same date, amount
     * and reference), including repeats inside this batch.
     */
    @Transactional
    public ImportResult importStatement(UUID reconciliationId, List<StatementLine> lines, String importedBy) {
        Reconciliation reconciliation = lockForUpdate(reconciliationId);
        reconciliation.requireMutable();

        if (lines == null || lines.isEmpty()) {
            throw new ValidationException("Statement must contain at least one transaction");
        }
        for (int i = 0; i < lines.size(); i++) {
            lines.get(i).validate(i + 1);
        }

        int imported = 0;
        for (StatementLine line : lines) {
            imported += reconciliationRepository.insertTransaction(reconciliationId, line);
        }
        ImportResult result = new ImportResult(imported, lines.size() - imported);

        Reconciliation started = reconciliation.startWork();
        if (started != reconciliation) {
            reconciliationRepository.update(started);
        }

        auditLogSink.record(AuditRecord.of("STATEMENT_IMPORTED", ENTITY_TYPE, reconciliationId,
            AuditRecord.values("status", reconciliation.getStatus()),
            AuditRecord.values("status", started.getStatus(), "imported", result.getImported(),
                "duplicatesSkipped", result.getDuplicatesSkipped(), "importedBy", importedBy)));

        log.info("Statement imported into reconciliation {}: imported={}, duplicatesSkipped={}",
            reconciliation.label(), result.getImported(), result.getDuplicatesSkipped());
        return result;
    }

    /**
     * Pairs one bank transaction with one posted line on the bank's GL account.
     *
     * @throws InvalidStateException if either side is already matched, or a reconciling item explains the transaction
     * @throws ValidationException if the line is not posted or is on another account
     */
    @Transactional
    public BankTransaction matchTransaction(UUID reconciliationId, UUID transactionId, UUID journalLineId,
                                            String matchedBy) {
        Reconciliation reconciliation = lockForUpdate(reconciliationId);
        reconciliation.requireMutable();
        BankAccount bankAccount = bankAccountService.getBankAccount(reconciliation.getBankAccountId());

        BankTransaction transaction = findTransaction(reconciliationId, transactionId);
        if (transaction.isMatched()) {
            throw new InvalidStateException("Bank transaction " + transactionId + " is already matched");
        }
        if (reconciliationRepository.isTransactionAccepted(transactionId)) {
            throw new InvalidStateException(
                "Bank transaction " + transactionId + " is already explained by a reconciling item");
        }

        PostedLine line = entryRepository.findPostedLine(journalLineId)
            .orElseThrow(() -> new ValidationException("Journal line " + journalLineId + " is not a posted line"));
        if (!line.getAccountId().equals(bankAccount.getLinkedAccountId())) {
            throw new ValidationException(
                "Journal line " + journalLineId + " is not on the bank account's GL account");
        }
        if (reconciliationRepository.isJournalLineMatched(journalLineId)) {
            throw new InvalidStateException("Journal line " + journalLineId + " is already matched");
        }

        applyMatch(transactionId, journalLineId, matchedBy);

        auditLogSink.record(AuditRecord.of("TRANSACTION_MATCHED", ENTITY_TYPE, reconciliationId,
            AuditRecord.values("bankTransactionId", transactionId, "matchStatus", transaction.getMatchStatus()),
            AuditRecord.values("bankTransactionId", transactionId, "matchStatus", MatchStatus.MATCHED,
                "journalLineId", journalLineId, "matchedBy", matchedBy)));

        log.info("Bank transaction {} matched to journal line {} ({})", transactionId, journalLineId, line.getEntryNumber());
        return findTransaction(reconciliationId, transactionId);
    }

    @Transactional
    public BankTransaction unmatchTransaction(UUID reconciliationId, UUID transactionId, String unmatchedBy) {
        Reconciliation reconciliation = lockForUpdate(reconciliationId);
        reconciliation.requireMutable();

        BankTransaction transaction = findTransaction(reconciliationId, transactionId);
        if (reconciliationRepository.markUnmatched(transactionId) == 0) {
            throw new InvalidStateException("Bank transaction " + transactionId + " is not matched");
        }

        auditLogSink.record(AuditRecord.of("TRANSACTION_UNMATCHED", ENTITY_TYPE, reconciliationId,
            AuditRecord.values("bankTransactionId", transactionId, "matchStatus", transaction.getMatchStatus(),
                "journalLineId", transaction.getMatchedJournalLineId()),
            AuditRecord.values("bankTransactionId", transactionId, "matchStatus", MatchStatus.UNMATCHED,
                "unmatchedBy", unmatchedBy)));

        log.info("Bank transaction {} unmatched by {}", transactionId, unmatchedBy);
        return findTransaction(reconciliationId, transactionId);
    }

    /**
     * @param dateToleranceDays null for the configured default
     */
    @Transactional
    public AutoMatchResult autoMatch(UUID reconciliationId, Integer dateToleranceDays, String matchedBy) {
        long startTime = System.currentTimeMillis();
        Reconciliation reconciliation = lockForUpdate(reconciliationId);
        reconciliation.requireMutable();
        BankAccount bankAccount = bankAccountService.getBankAccount(reconciliation.getBankAccountId());

        int tolerance = dateToleranceDays != null ? dateToleranceDays : defaultDateToleranceDays;
        if (tolerance < 0) {
            throw new ValidationException("Date tolerance must not be negative: " + tolerance);
        }

        List<BankTransaction> unmatched = reconciliationRepository.findTransactions(reconciliationId).stream()
            .filter(t -> !t.isMatched())
            .filter(t -> !reconciliationRepository.isTransactionAccepted(t.getId()))
            .toList();
        LocalDate from = reconciliation.yearMonth().atDay(1).minusDays(tolerance);
        LocalDate to = reconciliation.yearMonth().atEndOfMonth().plusDays(tolerance);
        List<PostedLine> candidates = reconciliationRepository.findUnmatchedPostedLines(
            bankAccount.getLinkedAccountId(), from, to);

        List<TransactionMatch> matches = autoMatcher.match(unmatched, candidates, tolerance);
        for (TransactionMatch match : matches) {
            applyMatch(match.getBankTransactionId(), match.getJournalLineId(), matchedBy);
        }

        AutoMatchResult result = new AutoMatchResult(matches.size(), unmatched.size() - matches.size(), matches);

        auditLogSink.record(AuditRecord.of("AUTO_MATCHED", ENTITY_TYPE, reconciliationId, null,
            AuditRecord.values("matchedCount", result.getMatchedCount(),
                "unmatchedCount", result.getUnmatchedCount(), "dateToleranceDays", tolerance,
                "matchedBy", matchedBy)));

        metrics.recordAutoMatch(result.getMatchedCount(), result.getUnmatchedCount());
        metrics.recordLatency("auto_match", System.currentTimeMillis() - startTime);
        log.info("Auto-match on reconciliation {}: matched={}, unmatched={}, candidates={}",
            reconciliation.label(), result.getMatchedCount(), result.getUnmatchedCount(), candidates.size());
        return result;
    }

    /**
     * @param bankTransactionId optional statement line this item explains; it then counts as resolved
     */
    @Transactional
    public ReconcilingItem addReconcilingItem(UUID reconciliationId, ReconcilingItemType itemType, String description,
                                              long amount, LocalDate itemDate, String reference,
                                              Boolean requiresJournalEntry, UUID bankTransactionId,
                                              String createdBy) {
        Reconciliation reconciliation = lockForUpdate(reconciliationId);
        reconciliation.requireMutable();

        ReconcilingItem item = ReconcilingItem.create(reconciliationId, itemType, description, amount, itemDate,
            reference, requiresJournalEntry, bankTransactionId, createdBy);

        if (bankTransactionId != null) {
            BankTransaction transaction = findTransaction(reconciliationId, bankTransactionId);
            if (transaction.isMatched()) {
                throw new InvalidStateException("Bank transaction " + bankTransactionId + " is already matched");
            }
            if (reconciliationRepository.isTransactionAccepted(bankTransactionId)) {
                throw new InvalidStateException(
                    "Bank transaction " + bankTransactionId + " is already explained by a reconciling item");
            }
        }

        reconciliationRepository.insertItem(item);

        auditLogSink.record(AuditRecord.of("RECONCILING_ITEM_ADDED", ENTITY_TYPE, reconciliationId, null,
            AuditRecord.values("itemId", item.getId(), "itemType", itemType, "amount", amount,
                "requiresJournalEntry", item.isRequiresJournalEntry(), "bankTransactionId", bankTransactionId)));

        log.info("Reconciling item added to {}: type={}, amount={}", reconciliation.label(), itemType, amount);
        return item;
    }

    /**
     * Computes the adjusted balances. They are stored unless the reconciliation
     * is already COMPLETED or APPROVED, in which case they are only returned.
     */
    @Transactional
    public AdjustedBalances calculate(UUID reconciliationId) {
        Reconciliation reconciliation = lockForUpdate(reconciliationId);
        AdjustedBalances balances = adjustedBalances(reconciliation);

        if (!reconciliation.getStatus().isFinished()) {
            reconciliationRepository.update(reconciliation.withAdjustedBalances(balances));
        }

        log.debug("Adjusted balances for {}: bank={}, book={}, reconciled={}", reconciliation.label(),
            balances.getAdjustedBankBalance(), balances.getAdjustedBookBalance(), balances.isReconciled());
        return balances;
    }

    /**
     * Creates DRAFT adjusting entries for reconciling items that need one and do not have one yet.
     * Items of types without a booking rule are skipped.
     *
     * @return the entries created, in item order
     */
    @Transactional
    public List<JournalEntry> createAdjustingEntries(UUID reconciliationId, AdjustingEntryAccounts accounts,
                                                     String createdBy) {
        Reconciliation reconciliation = lockForUpdate(reconciliationId);
        reconciliation.requireMutable();
        BankAccount bankAccount = bankAccountService.getBankAccount(reconciliation.getBankAccountId());
        UUID bankGl = bankAccount.getLinkedAccountId();

        List<JournalEntry> created = new ArrayList<>();
        for (ReconcilingItem item : reconciliationRepository.findItems(reconciliationId)) {
            if (!item.needsAdjustingEntry()) {
                continue;
            }

            List<JournalEntryRequest.Line> lines;
            switch (item.getItemType()) {
                case BANK_FEE -> lines = List.of(
                    JournalEntryRequest.Line.debit(required(accounts.getFeeExpenseAccountId(), "fee expense"),
                        item.getAmount(), item.getDescription()),
                    JournalEntryRequest.Line.credit(bankGl, item.getAmount(), item.getDescription()));
                case BANK_INTEREST -> lines = List.of(
                    JournalEntryRequest.Line.debit(bankGl, item.getAmount(), item.getDescription()),
                    JournalEntryRequest.Line.credit(required(accounts.getInterestIncomeAccountId(), "interest income"),
                        item.getAmount(), item.getDescription()));
                case NSF_CHECK -> lines = List.of(
                    JournalEntryRequest.Line.debit(required(accounts.nsfOrFeeAccountId(), "NSF"),
                        item.getAmount(), item.getDescription()),
                    JournalEntryRequest.Line.credit(bankGl, item.getAmount(), item.getDescription()));
                default -> {
                    log.warn("No adjusting entry rule for {} item {}; skipped", item.getItemType(), item.getId());
                    continue;
                }
            }

            JournalEntryRequest request = new JournalEntryRequest(
                item.getItemDate(),
                String.format("Bank reconciliation %s: %s", reconciliation.label(), item.getDescription()),
                item.getReference(),
                JournalEntryType.ADJUSTING,
                createdBy,
                lines);
            JournalEntry entry = journalEntryService.createEntry(request, null);
            reconciliationRepository.linkItemToEntry(item.getId(), entry.getId());
            created.add(entry);
        }

        auditLogSink.record(AuditRecord.of("ADJUSTING_ENTRIES_CREATED", ENTITY_TYPE, reconciliationId, null,
            AuditRecord.values("entryCount", created.size(),
                "entryIds", created.stream().map(JournalEntry::getId).toList(), "createdBy", createdBy)));

        log.info("Created {} adjusting entries for reconciliation {}", created.size(), reconciliation.label());
        return created;
    }

    /**
     * @throws com.flagship.general_ledger.exception.NotReconciledException if a difference or an unresolved transaction remains
     */
    @Transactional
    public Reconciliation complete(UUID reconciliationId, String completedBy) {
        Reconciliation reconciliation = lockForUpdate(reconciliationId);
        reconciliation.requireMutable();

        AdjustedBalances balances = adjustedBalances(reconciliation);
        int unresolved = reconciliationRepository.countUnresolvedTransactions(reconciliationId);
        Reconciliation completed = reconciliation.complete(balances, unresolved, completedBy);
        reconciliationRepository.update(completed);

        auditLogSink.record(AuditRecord.of("RECONCILIATION_COMPLETED", ENTITY_TYPE, reconciliationId,
            AuditRecord.values("status", reconciliation.getStatus()),
            AuditRecord.values("status", completed.getStatus(), "completedBy", completedBy,
                "adjustedBankBalance", balances.getAdjustedBankBalance(),
                "adjustedBookBalance", balances.getAdjustedBookBalance())));

        log.info("Reconciliation {} completed by {}", completed.label(), completedBy);
        return completed;
    }

    @Transactional
    public Reconciliation approve(UUID reconciliationId, String approvedBy) {
        Reconciliation reconciliation = lockForUpdate(reconciliationId);
        Reconciliation approved = reconciliation.approve(approvedBy);
        reconciliationRepository.update(approved);

        bankAccountService.recordReconciled(approved.getBankAccountId(), approved.getFiscalYear(),
            approved.getFiscalMonth(), approved.getAdjustedBankBalance());

        auditLogSink.record(AuditRecord.of("RECONCILIATION_APPROVED", ENTITY_TYPE, reconciliationId,
            AuditRecord.values("status", reconciliation.getStatus()),
            AuditRecord.values("status", approved.getStatus(), "approvedBy", approvedBy)));

        log.info("Reconciliation {} approved by {}", approved.label(), approvedBy);
        return approved;
    }

    private AdjustedBalances adjustedBalances(Reconciliation reconciliation) {
        return AdjustedBalances.calculate(reconciliation.getStatementEndingBalance(),
            reconciliation.getBookEndingBalance(), reconciliationRepository.findItems(reconciliation.getId()));
    }

    private void applyMatch(UUID transactionId, UUID journalLineId, String matchedBy) {
        int updated;
        try {
            updated = reconciliationRepository.markMatched(transactionId, journalLineId, matchedBy, Instant.now());
        } catch (DuplicateKeyException e) {
            throw new InvalidStateException("Journal line " + journalLineId + " is already matched");
        }
        if (updated == 0) {
            throw new InvalidStateException("Bank transaction " + transactionId + " is already matched");
        }
    }

    private Reconciliation lockForUpdate(UUID reconciliationId) {
        return reconciliationRepository.findByIdForUpdate(reconciliationId)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, reconciliationId));
    }

    private BankTransaction findTransaction(UUID reconciliationId, UUID transactionId) {
        return reconciliationRepository.findTransaction(reconciliationId, transactionId)
            .orElseThrow(() -> NotFoundException.of("Bank transaction", transactionId));
    }

    private static UUID required(UUID accountId, String role) {
        if (accountId == null) {
            throw new ValidationException("The " + role + " account is required for adjusting entries");
        }
        return accountId;
    }
}
