package com.flagship.general_ledger.period;

import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * A fiscal month and its close lifecycle.
 *
 * <pre>
 *   OPEN --close--> CLOSED --lock--> LOCKED
 *     ^               |
 *     +----reopen-----+
 * </pre>
 *
 * Transitions return a new instance; invalid ones throw {@link InvalidStateException}.
 */
@Value
@Builder(toBuilder = true)
public class FiscalPeriod {

    public static final int MIN_YEAR = 1900;
    public static final int MIN_REOPEN_REASON_LENGTH = 10;

    UUID id;
    int fiscalYear;
    int fiscalMonth;
    FiscalPeriodStatus status;
    String closedBy;
    Instant closedAt;
    String reopenedBy;
    Instant reopenedAt;
    String reopenReason;
    String lockedBy;
    Instant lockedAt;
    Instant createdAt;

    public static FiscalPeriod create(int fiscalYear, int fiscalMonth) {
        validateYearMonth(fiscalYear, fiscalMonth);
        return FiscalPeriod.builder()
            .id(UUID.randomUUID())
            .fiscalYear(fiscalYear)
            .fiscalMonth(fiscalMonth)
            .status(FiscalPeriodStatus.OPEN)
            .createdAt(Instant.now())
            .build();
    }

    public static void validateYearMonth(int fiscalYear, int fiscalMonth) {
        if (fiscalYear < MIN_YEAR) {
            throw new ValidationException("Fiscal year must be " + MIN_YEAR + " or later: " + fiscalYear);
        }
        if (fiscalMonth < 1 || fiscalMonth > 12) {
            throw new ValidationException("Fiscal month must be between 1 and 12: " + fiscalMonth);
        }
    }

    /**
     * @throws InvalidStateException unless the period is OPEN
     */
    public FiscalPeriod close(String closedBy) {
        if (status != FiscalPeriodStatus.OPEN) {
            throw new InvalidStateException(String.format(
                "Cannot close period %s in %s status. Only OPEN periods can be closed.", label(), status));
        }
        return toBuilder()
            .status(FiscalPeriodStatus.CLOSED)
            .closedBy(closedBy)
            .closedAt(Instant.now())
            .build();
    }

    /**
     * @throws InvalidStateException if the period is LOCKED or already OPEN
     * @throws ValidationException if the reason is shorter than 10 characters
     */
    public FiscalPeriod reopen(String reason, String reopenedBy) {
        switch (status) {
            case LOCKED -> throw new InvalidStateException(
                "Period " + label() + " is LOCKED and can never be reopened");
            case OPEN -> throw new InvalidStateException(
                "Period " + label() + " is already OPEN");
            case CLOSED -> {
                // allowed
            }
        }
        if (reason == null || reason.trim().length() < MIN_REOPEN_REASON_LENGTH) {
            throw new ValidationException(
                "Reopen reason must be at least " + MIN_REOPEN_REASON_LENGTH + " characters");
        }
        return toBuilder()
            .status(FiscalPeriodStatus.OPEN)
            .reopenedBy(reopenedBy)
            .reopenedAt(Instant.now())
            .reopenReason(reason.trim())
            .build();
    }

    /**
     * @throws InvalidStateException unless the period is CLOSED
     */
    public FiscalPeriod lock(String lockedBy) {
        if (status != FiscalPeriodStatus.CLOSED) {
            throw new InvalidStateException(String.format(
                "Cannot lock period %s in %s status. Only CLOSED periods can be locked.", label(), status));
        }
        return toBuilder()
            .status(FiscalPeriodStatus.LOCKED)
            .lockedBy(lockedBy)
            .lockedAt(Instant.now())
            .build();
    }

    public boolean acceptsPostings() {
        return status == FiscalPeriodStatus.OPEN;
    }

    public YearMonth yearMonth() {
        return YearMonth.of(fiscalYear, fiscalMonth);
    }

    public LocalDate startDate() {
        return yearMonth().atDay(1);
    }

    public LocalDate endDate() {
        return yearMonth().atEndOfMonth();
    }

    public String label() {
        return String.format("%d-%02d", fiscalYear, fiscalMonth);
    }
}
