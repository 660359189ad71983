package com.flagship.general_ledger.period.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.period.FiscalPeriod;
import com.flagship.general_ledger.period.FiscalPeriodStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class FiscalPeriodResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("fiscal_year")
    int fiscalYear;

    @JsonProperty("fiscal_month")
    int fiscalMonth;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("status")
    FiscalPeriodStatus status;

    @JsonProperty("closed_by")
    String closedBy;

    @JsonProperty("closed_at")
    Instant closedAt;

    @JsonProperty("reopened_by")
    String reopenedBy;

    @JsonProperty("reopened_at")
    Instant reopenedAt;

    @JsonProperty("reopen_reason")
    String reopenReason;

    @JsonProperty("locked_by")
    String lockedBy;

    @JsonProperty("locked_at")
    Instant lockedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static FiscalPeriodResponse from(FiscalPeriod period) {
        return FiscalPeriodResponse.builder()
            .id(period.getId())
            .fiscalYear(period.getFiscalYear())
            .fiscalMonth(period.getFiscalMonth())
            .startDate(period.startDate())
            .endDate(period.endDate())
            .status(period.getStatus())
            .closedBy(period.getClosedBy())
            .closedAt(period.getClosedAt())
            .reopenedBy(period.getReopenedBy())
            .reopenedAt(period.getReopenedAt())
            .reopenReason(period.getReopenReason())
            .lockedBy(period.getLockedBy())
            .lockedAt(period.getLockedAt())
            .createdAt(period.getCreatedAt())
            .build();
    }
}
