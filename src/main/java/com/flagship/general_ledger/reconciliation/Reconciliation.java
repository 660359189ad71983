package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.NotReconciledException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.period.FiscalPeriod;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.YearMonth;
import java.util.UUID;

/**
 * A bank statement reconciliation for one bank account and month.
 *
 * <pre>
 *   DRAFT --import--> IN_PROGRESS --complete--> COMPLETED --approve--> APPROVED
 *     |                                            ^
 *     +------------------complete------------------+
 * </pre>
 *
 * COMPLETED and APPROVED reconciliations are read-only.
 */
@Value
@Builder(toBuilder = true)
public class Reconciliation {

    UUID id;
    UUID bankAccountId;
    int fiscalYear;
    int fiscalMonth;
    long statementEndingBalance;
    long bookEndingBalance;
    Long adjustedBankBalance;
    Long adjustedBookBalance;
    ReconciliationStatus status;
    String createdBy;
    String completedBy;
    Instant completedAt;
    String approvedBy;
    Instant approvedAt;
    Instant createdAt;

    public static Reconciliation create(UUID bankAccountId, int fiscalYear, int fiscalMonth,
                                        long statementEndingBalance, long bookEndingBalance, String createdBy) {
        FiscalPeriod.validateYearMonth(fiscalYear, fiscalMonth);
        if (createdBy == null || createdBy.isBlank()) {
            throw new ValidationException("Created by is required");
        }
        return Reconciliation.builder()
            .id(UUID.randomUUID())
            .bankAccountId(bankAccountId)
            .fiscalYear(fiscalYear)
            .fiscalMonth(fiscalMonth)
            .statementEndingBalance(statementEndingBalance)
            .bookEndingBalance(bookEndingBalance)
            .status(ReconciliationStatus.DRAFT)
            .createdBy(createdBy)
            .createdAt(Instant.now())
            .build();
    }

    /**
     * @throws InvalidStateException if COMPLETED or APPROVED
     */
    public void requireMutable() {
        if (status.isFinished()) {
            throw new InvalidStateException(String.format(
                "Reconciliation %s is %s and can no longer be changed", label(), status));
        }
    }

    /**
     * DRAFT -> IN_PROGRESS once statement lines exist; otherwise unchanged.
     */
    public Reconciliation startWork() {
        requireMutable();
        return status == ReconciliationStatus.DRAFT
            ? toBuilder().status(ReconciliationStatus.IN_PROGRESS).build()
            : this;
    }

    public Reconciliation withAdjustedBalances(AdjustedBalances balances) {
        requireMutable();
        return toBuilder()
            .adjustedBankBalance(balances.getAdjustedBankBalance())
            .adjustedBookBalance(balances.getAdjustedBookBalance())
            .build();
    }

    /**
     * @param unresolvedTransactions bank transactions neither matched nor accepted as a reconciling item
     * @throws NotReconciledException if the adjusted balances differ or transactions are unresolved
     */
    public Reconciliation complete(AdjustedBalances balances, int unresolvedTransactions, String completedBy) {
        requireMutable();
        if (completedBy == null || completedBy.isBlank()) {
            throw new ValidationException("Completed by is required");
        }
        if (!balances.isReconciled()) {
            throw new NotReconciledException(String.format(
                "Reconciliation %s has an unexplained difference of %d (adjusted bank %d, adjusted book %d)",
                label(), balances.getDifference(), balances.getAdjustedBankBalance(), balances.getAdjustedBookBalance()));
        }
        if (unresolvedTransactions > 0) {
            throw new NotReconciledException(String.format(
                "Reconciliation %s has %d bank transactions that are neither matched nor accepted",
                label(), unresolvedTransactions));
        }
        return withAdjustedBalances(balances).toBuilder()
            .status(ReconciliationStatus.COMPLETED)
            .completedBy(completedBy)
            .completedAt(Instant.now())
            .build();
    }

    /**
     * @throws InvalidStateException unless COMPLETED
     */
    public Reconciliation approve(String approvedBy) {
        if (status != ReconciliationStatus.COMPLETED) {
            throw new InvalidStateException(String.format(
                "Cannot approve reconciliation %s in %s status. Only COMPLETED reconciliations can be approved.",
                label(), status));
        }
        if (approvedBy == null || approvedBy.isBlank()) {
            throw new ValidationException("Approved by is required");
        }
        return toBuilder()
            .status(ReconciliationStatus.APPROVED)
            .approvedBy(approvedBy)
            .approvedAt(Instant.now())
            .build();
    }

    public YearMonth yearMonth() {
        return YearMonth.of(fiscalYear, fiscalMonth);
    }

    public String label() {
        return String.format("%d-%02d", fiscalYear, fiscalMonth);
    }
}
