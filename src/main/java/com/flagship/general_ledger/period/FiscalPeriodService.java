package com.flagship.general_ledger.period;

import com.flagship.general_ledger.audit.AuditLogSink;
import com.flagship.general_ledger.audit.AuditRecord;
import com.flagship.general_ledger.balance.AccountBalanceService;
import com.flagship.general_ledger.balance.RecalculationResult;
import com.flagship.general_ledger.balance.TrialBalance;
import com.flagship.general_ledger.event.FiscalPeriodClosedEvent;
import com.flagship.general_ledger.exception.DuplicatePeriodException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.PeriodClosedException;
import com.flagship.general_ledger.exception.UnbalancedPeriodException;
import com.flagship.general_ledger.journal.JournalEntryRepository;
import com.flagship.general_ledger.journal.JournalEntryStatus;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Fiscal period lifecycle: create, close, reopen, lock.
 *
 * Close holds an exclusive lock on the period row while it recalculates
 * balances, so no entry can be posted into the period between the balance
 * check and the status change. Posting and voiding take a shared lock on the
 * same row through {@link #requireOpenForPosting} and {@link #lockForShare}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FiscalPeriodService {

    static final String ENTITY_TYPE = "FiscalPeriod";

    private final FiscalPeriodRepository periodRepository;
    private final AccountBalanceService balanceService;
    private final JournalEntryRepository entryRepository;
    private final OutboxService outboxService;
    private final AuditLogSink auditLogSink;
    private final LedgerMetrics metrics;

    /**
     * @throws DuplicatePeriodException if the year/month already exists
     */
    @Transactional
    public FiscalPeriod createPeriod(int fiscalYear, int fiscalMonth) {
        FiscalPeriod period = FiscalPeriod.create(fiscalYear, fiscalMonth);

        if (periodRepository.existsByFiscalYearAndFiscalMonth(fiscalYear, fiscalMonth)) {
            throw new DuplicatePeriodException(fiscalYear, fiscalMonth);
        }

        FiscalPeriod saved;
        try {
            saved = periodRepository.saveAndFlush(FiscalPeriodEntity.fromDomain(period)).toDomain();
        } catch (DataIntegrityViolationException e) {
            // Lost a race with a concurrent create of the same month
            throw new DuplicatePeriodException(fiscalYear, fiscalMonth);
        }

        auditLogSink.record(AuditRecord.of("PERIOD_CREATED", ENTITY_TYPE, saved.getId(), null,
            AuditRecord.values("fiscalYear", fiscalYear, "fiscalMonth", fiscalMonth, "status", saved.getStatus())));

        log.info("Fiscal period created: {}", saved.label());
        return saved;
    }

    @Transactional(readOnly = true)
    public FiscalPeriod getPeriod(UUID periodId) {
        return periodRepository.findById(periodId)
            .map(FiscalPeriodEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, periodId));
    }

    @Transactional(readOnly = true)
    public FiscalPeriod getPeriod(int fiscalYear, int fiscalMonth) {
        return periodRepository.findByFiscalYearAndFiscalMonth(fiscalYear, fiscalMonth)
            .map(FiscalPeriodEntity::toDomain)
            .orElseThrow(() -> notFound(fiscalYear, fiscalMonth));
    }

    @Transactional(readOnly = true)
    public List<FiscalPeriod> listPeriods(Integer fiscalYear) {
        List<FiscalPeriodEntity> entities = fiscalYear == null
            ? periodRepository.findAllByOrderByFiscalYearAscFiscalMonthAsc()
            : periodRepository.findByFiscalYearOrderByFiscalMonthAsc(fiscalYear);
        return entities.stream().map(FiscalPeriodEntity::toDomain).toList();
    }

    /**
     * Takes a shared lock on the period row and returns the period, whatever its status.
     * Must run inside the caller's transaction so the lock lasts until it commits.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public FiscalPeriod lockForShare(int fiscalYear, int fiscalMonth) {
        return periodRepository.findForShare(fiscalYear, fiscalMonth)
            .map(FiscalPeriodEntity::toDomain)
            .orElseThrow(() -> notFound(fiscalYear, fiscalMonth));
    }

    /**
     * Shared-locks the period and checks that it accepts postings.
     *
     * @throws NotFoundException if the period does not exist
     * @throws PeriodClosedException if it is CLOSED or LOCKED
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public FiscalPeriod requireOpenForPosting(int fiscalYear, int fiscalMonth) {
        FiscalPeriod period = lockForShare(fiscalYear, fiscalMonth);
        if (!period.acceptsPostings()) {
            throw new PeriodClosedException(fiscalYear, fiscalMonth, period.getStatus().name());
        }
        return period;
    }

    /**
     * OPEN -> CLOSED, provided the recalculated trial balance balances.
     *
     * @throws UnbalancedPeriodException if total debits differ from total credits
     */
    @Transactional
    public FiscalPeriod closePeriod(UUID periodId, String closedBy) {
        long startTime = System.currentTimeMillis();
        FiscalPeriodEntity entity = periodRepository.findByIdForUpdate(periodId)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, periodId));
        FiscalPeriod current = entity.toDomain();

        try {
            FiscalPeriod closed = current.close(closedBy);

            RecalculationResult result = balanceService.recalculate(current.getFiscalYear(), current.getFiscalMonth());
            if (!result.isBalanced()) {
                throw new UnbalancedPeriodException(current.getFiscalYear(), current.getFiscalMonth(),
                    result.getTotalDebits(), result.getTotalCredits());
            }

            entity.updateFromDomain(closed);
            FiscalPeriod saved = periodRepository.saveAndFlush(entity).toDomain();

            outboxService.saveDomainEvent(new FiscalPeriodClosedEvent(
                UUID.randomUUID(), saved.getId(), saved.getFiscalYear(), saved.getFiscalMonth(),
                result.getAccountsProcessed(), result.getTotalDebits(), result.getTotalCredits(),
                closedBy, Instant.now()));
            auditLogSink.record(AuditRecord.of("PERIOD_CLOSED", ENTITY_TYPE, saved.getId(),
                AuditRecord.values("status", current.getStatus()),
                AuditRecord.values("status", saved.getStatus(), "closedBy", closedBy,
                    "totalDebits", result.getTotalDebits(), "totalCredits", result.getTotalCredits())));

            metrics.recordPeriodTransition("close", "success");
            metrics.recordLatency("period_close", System.currentTimeMillis() - startTime);
            log.info("Fiscal period closed: {} by {}", saved.label(), closedBy);
            return saved;

        } catch (RuntimeException e) {
            metrics.recordPeriodTransition("close", "rejected");
            log.warn("Close of period {} rejected: {}", current.label(), e.getMessage());
            throw e;
        }
    }

    /**
     * CLOSED -> OPEN. LOCKED periods can never be reopened.
     */
    @Transactional
    public FiscalPeriod reopenPeriod(UUID periodId, String reason, String reopenedBy) {
        FiscalPeriodEntity entity = periodRepository.findByIdForUpdate(periodId)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, periodId));
        FiscalPeriod current = entity.toDomain();

        FiscalPeriod reopened;
        try {
            reopened = current.reopen(reason, reopenedBy);
        } catch (RuntimeException e) {
            metrics.recordPeriodTransition("reopen", "rejected");
            throw e;
        }

        entity.updateFromDomain(reopened);
        FiscalPeriod saved = periodRepository.saveAndFlush(entity).toDomain();

        auditLogSink.record(AuditRecord.of("PERIOD_REOPENED", ENTITY_TYPE, saved.getId(),
            AuditRecord.values("status", current.getStatus()),
            AuditRecord.values("status", saved.getStatus(), "reopenedBy", reopenedBy,
                "reason", saved.getReopenReason())));

        metrics.recordPeriodTransition("reopen", "success");
        log.warn("Fiscal period reopened: {} by {}, reason: {}", saved.label(), reopenedBy, saved.getReopenReason());
        return saved;
    }

    /**
     * CLOSED -> LOCKED. There is no unlock.
     */
    @Transactional
    public FiscalPeriod lockPeriod(UUID periodId, String lockedBy) {
        FiscalPeriodEntity entity = periodRepository.findByIdForUpdate(periodId)
            .orElseThrow(() -> NotFoundException.of(ENTITY_TYPE, periodId));
        FiscalPeriod current = entity.toDomain();

        FiscalPeriod locked;
        try {
            locked = current.lock(lockedBy);
        } catch (RuntimeException e) {
            metrics.recordPeriodTransition("lock", "rejected");
            throw e;
        }

        entity.updateFromDomain(locked);
        FiscalPeriod saved = periodRepository.saveAndFlush(entity).toDomain();

        auditLogSink.record(AuditRecord.of("PERIOD_LOCKED", ENTITY_TYPE, saved.getId(),
            AuditRecord.values("status", current.getStatus()),
            AuditRecord.values("status", saved.getStatus(), "lockedBy", lockedBy)));

        metrics.recordPeriodTransition("lock", "success");
        log.info("Fiscal period locked: {} by {}", saved.label(), lockedBy);
        return saved;
    }

    @Transactional(readOnly = true)
    public CloseChecklist closeChecklist(UUID periodId) {
        FiscalPeriod period = getPeriod(periodId);
        TrialBalance trialBalance = balanceService.trialBalance(period.getFiscalYear(), period.getFiscalMonth());
        int drafts = entryRepository.countByPeriodAndStatus(
            period.getFiscalYear(), period.getFiscalMonth(), JournalEntryStatus.DRAFT);

        YearMonth previous = period.yearMonth().minusMonths(1);
        FiscalPeriodStatus previousStatus = periodRepository
            .findByFiscalYearAndFiscalMonth(previous.getYear(), previous.getMonthValue())
            .map(FiscalPeriodEntity::getStatus)
            .orElse(null);

        List<String> blockers = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (period.getStatus() != FiscalPeriodStatus.OPEN) {
            blockers.add("Period is " + period.getStatus());
        }
        if (!trialBalance.isBalanced()) {
            blockers.add(String.format("Trial balance is not balanced: debits=%d, credits=%d",
                trialBalance.getTotalDebits(), trialBalance.getTotalCredits()));
        }
        if (drafts > 0) {
            warnings.add(drafts + " draft entries will stay unposted");
        }
        if (previousStatus == FiscalPeriodStatus.OPEN) {
            warnings.add("Previous period " + previous + " is still OPEN");
        }

        return new CloseChecklist(period.getId(), period.getFiscalYear(), period.getFiscalMonth(),
            period.getStatus(), trialBalance.isBalanced(), trialBalance.getTotalDebits(),
            trialBalance.getTotalCredits(), drafts, previousStatus, List.copyOf(blockers), List.copyOf(warnings));
    }

    private static NotFoundException notFound(int fiscalYear, int fiscalMonth) {
        return new NotFoundException(String.format("Fiscal period not found: %d-%02d", fiscalYear, fiscalMonth));
    }
}
