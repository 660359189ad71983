package com.flagship.general_ledger.period;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "fiscal_periods")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FiscalPeriodEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "fiscal_year", nullable = false, updatable = false)
    private int fiscalYear;

    @Column(name = "fiscal_month", nullable = false, updatable = false)
    private int fiscalMonth;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private FiscalPeriodStatus status;

    @Column(name = "closed_by")
    private String closedBy;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "reopened_by")
    private String reopenedBy;

    @Column(name = "reopened_at")
    private Instant reopenedAt;

    @Column(name = "reopen_reason", columnDefinition = "TEXT")
    private String reopenReason;

    @Column(name = "locked_by")
    private String lockedBy;

    @Column(name = "locked_at")
    private Instant lockedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static FiscalPeriodEntity fromDomain(FiscalPeriod period) {
        return new FiscalPeriodEntity(
            period.getId(),
            period.getFiscalYear(),
            period.getFiscalMonth(),
            period.getStatus(),
            period.getClosedBy(),
            period.getClosedAt(),
            period.getReopenedBy(),
            period.getReopenedAt(),
            period.getReopenReason(),
            period.getLockedBy(),
            period.getLockedAt(),
            null, // set by @PrePersist
            null
        );
    }

    public FiscalPeriod toDomain() {
        return new FiscalPeriod(
            id,
            fiscalYear,
            fiscalMonth,
            status,
            closedBy,
            closedAt,
            reopenedBy,
            reopenedAt,
            reopenReason,
            lockedBy,
            lockedAt,
            createdAt
        );
    }

    /**
     * Copies the lifecycle fields; year and month never change.
     */
    void updateFromDomain(FiscalPeriod period) {
        this.status = period.getStatus();
        this.closedBy = period.getClosedBy();
        this.closedAt = period.getClosedAt();
        this.reopenedBy = period.getReopenedBy();
        this.reopenedAt = period.getReopenedAt();
        this.reopenReason = period.getReopenReason();
        this.lockedBy = period.getLockedBy();
        this.lockedAt = period.getLockedAt();
    }
}
