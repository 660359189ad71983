package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountService;
import com.flagship.general_ledger.audit.AuditLogSink;
import com.flagship.general_ledger.audit.AuditRecord;
import com.flagship.general_ledger.event.JournalEntryPostedEvent;
import com.flagship.general_ledger.event.JournalEntryVoidedEvent;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.PeriodClosedException;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.outbox.OutboxService;
import com.flagship.general_ledger.period.FiscalPeriod;
import com.flagship.general_ledger.period.FiscalPeriodService;
import com.flagship.general_ledger.period.FiscalPeriodStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Journal entry lifecycle: create (DRAFT), post, void, delete draft.
 *
 * Every write runs in one transaction that also holds a shared lock on the
 * entry's fiscal period row, so a concurrent period close either waits for it
 * or is waited on. Status flips are guarded updates; losing a race on the same
 * entry surfaces as {@link InvalidStateException}.
 */
@Service
@Slf4j
public class JournalEntryService {

    static final String ENTITY_TYPE = "JournalEntry";

    private final JournalEntryRepository entryRepository;
    private final AccountService accountService;
    private final FiscalPeriodService periodService;
    private final OutboxService outboxService;
    private final AuditLogSink auditLogSink;
    private final LedgerMetrics metrics;
    private final VoidPolicy voidPolicy;

    public JournalEntryService(JournalEntryRepository entryRepository,
                               AccountService accountService,
                               FiscalPeriodService periodService,
                               OutboxService outboxService,
                               AuditLogSink auditLogSink,
                               LedgerMetrics metrics,
                               @Value("${ledger.journal.void-in-closed-period:ALLOW}") VoidPolicy voidPolicy) {
        this.entryRepository = entryRepository;
        this.accountService = accountService;
        this.periodService = periodService;
        this.outboxService = outboxService;
        this.auditLogSink = auditLogSink;
        this.metrics = metrics;
        this.voidPolicy = voidPolicy;
        log.info("Journal void policy for CLOSED periods: {}", voidPolicy);
    }

    /**
     * Validates and stores a new DRAFT entry.
     *
     * @param idempotencyKey stored on the entry row when not null
     * @throws com.flagship.general_ledger.exception.ValidationException if the entry is malformed or unbalanced
     * @throws NotFoundException if an account or the fiscal period does not exist
     * @throws PeriodClosedException if the fiscal period is not OPEN
     */
    @Transactional
    public JournalEntry createEntry(JournalEntryRequest request, String idempotencyKey) {
        request.validate();

        Map<UUID, Account> accounts = accountService.getAccounts(request.accountIds());
        accounts.values().forEach(AccountService::requireActive);

        int fiscalYear = request.getEntryDate().getYear();
        int fiscalMonth = request.getEntryDate().getMonthValue();
        periodService.requireOpenForPosting(fiscalYear, fiscalMonth);

        String entryNumber = JournalEntry.formatEntryNumber(fiscalYear, entryRepository.nextEntrySequence());
        JournalEntry entry = JournalEntry.draft(UUID.randomUUID(), entryNumber, request);
        entryRepository.insert(entry, idempotencyKey);

        auditLogSink.record(AuditRecord.of("JOURNAL_ENTRY_CREATED", ENTITY_TYPE, entry.getId(), null,
            AuditRecord.values(
                "entryNumber", entry.getEntryNumber(),
                "entryDate", entry.getEntryDate(),
                "entryType", entry.getEntryType(),
                "status", entry.getStatus(),
                "totalAmount", entry.getDebitTotal(),
                "lineCount", entry.getLines().size())));

        log.info("Journal entry created: number={}, date={}, type={}, amount={}",
            entry.getEntryNumber(), entry.getEntryDate(), entry.getEntryType(), entry.getDebitTotal());
        return entry;
    }

    @Transactional(readOnly = true)
    public JournalEntry getEntry(UUID entryId) {
        return entryRepository.findById(entryId)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, entryId));
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> listEntries(LocalDate fromDate, LocalDate toDate,
                                          JournalEntryStatus status, JournalEntryType entryType) {
        return entryRepository.find(fromDate, toDate, status, entryType);
    }

    /**
     * DRAFT -> POSTED. The period is re-checked under a shared lock in the
     * same transaction as the status flip.
     *
     * @throws InvalidStateException if the entry is not DRAFT, including when a concurrent post won
     * @throws PeriodClosedException if the period is no longer OPEN
     */
    @Transactional
    public JournalEntry postEntry(UUID entryId, String postedBy) {
        JournalEntry current = getEntry(entryId);
        JournalEntry posted = current.post(postedBy);

        periodService.requireOpenForPosting(current.getFiscalYear(), current.getFiscalMonth());

        int updated = entryRepository.markPosted(entryId, posted.getPostedBy(), posted.getPostedAt());
        if (updated == 0) {
            throw new InvalidStateException(
                "Journal entry " + current.getEntryNumber() + " was already posted or removed");
        }

        outboxService.saveDomainEvent(new JournalEntryPostedEvent(
            UUID.randomUUID(), posted.getId(), posted.getEntryNumber(), posted.getEntryDate(),
            posted.getFiscalYear(), posted.getFiscalMonth(), posted.getEntryType().name(),
            posted.getDebitTotal(), posted.getLines().size(), postedBy, Instant.now()));
        auditLogSink.record(AuditRecord.of("JOURNAL_ENTRY_POSTED", ENTITY_TYPE, entryId,
            AuditRecord.values("status", current.getStatus()),
            AuditRecord.values("status", posted.getStatus(), "postedBy", postedBy)));

        log.info("Journal entry posted: number={}, by={}", posted.getEntryNumber(), postedBy);
        return posted;
    }

    /**
     * POSTED -> VOIDED. Entries in LOCKED periods are never voided; entries in
     * CLOSED periods follow the configured {@link VoidPolicy}.
     */
    @Transactional
    public JournalEntry voidEntry(UUID entryId, String reason, String voidedBy) {
        JournalEntry current = getEntry(entryId);
        JournalEntry voided = current.voidEntry(reason, voidedBy);

        FiscalPeriod period = periodService.lockForShare(current.getFiscalYear(), current.getFiscalMonth());
        if (period.getStatus() == FiscalPeriodStatus.LOCKED
                || (period.getStatus() == FiscalPeriodStatus.CLOSED && voidPolicy == VoidPolicy.REJECT)) {
            throw new PeriodClosedException(String.format(
                "Cannot void journal entry %s: fiscal period %s is %s",
                current.getEntryNumber(), period.label(), period.getStatus()));
        }

        int updated = entryRepository.markVoided(entryId, voided.getVoidedBy(), voided.getVoidedAt(),
            voided.getVoidReason());
        if (updated == 0) {
            throw new InvalidStateException(
                "Journal entry " + current.getEntryNumber() + " was already voided");
        }

        if (period.getStatus() == FiscalPeriodStatus.CLOSED) {
            log.warn("Journal entry {} voided in CLOSED period {}; stored balances are stale until the period is reopened and recalculated",
                current.getEntryNumber(), period.label());
        }

        outboxService.saveDomainEvent(new JournalEntryVoidedEvent(
            UUID.randomUUID(), voided.getId(), voided.getEntryNumber(), voided.getEntryDate(),
            voided.getFiscalYear(), voided.getFiscalMonth(), period.getStatus().name(),
            voided.getVoidReason(), voidedBy, Instant.now()));
        auditLogSink.record(AuditRecord.of("JOURNAL_ENTRY_VOIDED", ENTITY_TYPE, entryId,
            AuditRecord.values("status", current.getStatus()),
            AuditRecord.values("status", voided.getStatus(), "voidedBy", voidedBy,
                "reason", voided.getVoidReason(), "periodStatus", period.getStatus())));

        log.info("Journal entry voided: number={}, by={}, reason={}",
            voided.getEntryNumber(), voidedBy, voided.getVoidReason());
        return voided;
    }

    /**
     * Removes a DRAFT entry and its lines. Posted entries are voided instead.
     */
    @Transactional
    public void deleteDraft(UUID entryId) {
        JournalEntry current = getEntry(entryId);
        if (current.getStatus() != JournalEntryStatus.DRAFT) {
            throw new InvalidStateException(String.format(
                "Cannot delete journal entry %s in %s status. Only DRAFT entries can be deleted.",
                current.getEntryNumber(), current.getStatus()));
        }
        if (entryRepository.deleteDraft(entryId) == 0) {
            throw new InvalidStateException(
                "Journal entry " + current.getEntryNumber() + " was posted before it could be deleted");
        }

        auditLogSink.record(AuditRecord.of("JOURNAL_ENTRY_DELETED", ENTITY_TYPE, entryId,
            AuditRecord.values("entryNumber", current.getEntryNumber(), "status", current.getStatus()), null));

        log.info("Draft journal entry deleted: number={}", current.getEntryNumber());
    }

    public VoidPolicy getVoidPolicy() {
        return voidPolicy;
    }
}
