package com.flagship.general_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.journal.Direction;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryStatus;
import com.flagship.general_ledger.journal.JournalEntryType;
import com.flagship.general_ledger.journal.JournalLine;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("entry_number")
    String entryNumber;

    @JsonProperty("entry_date")
    LocalDate entryDate;

    @JsonProperty("fiscal_year")
    int fiscalYear;

    @JsonProperty("fiscal_month")
    int fiscalMonth;

    @JsonProperty("description")
    String description;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("entry_type")
    JournalEntryType entryType;

    @JsonProperty("status")
    JournalEntryStatus status;

    @JsonProperty("total_debits")
    long totalDebits;

    @JsonProperty("total_credits")
    long totalCredits;

    @JsonProperty("lines")
    List<Line> lines;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("posted_by")
    String postedBy;

    @JsonProperty("posted_at")
    Instant postedAt;

    @JsonProperty("voided_by")
    String voidedBy;

    @JsonProperty("voided_at")
    Instant voidedAt;

    @JsonProperty("void_reason")
    String voidReason;

    @JsonProperty("created_at")
    Instant createdAt;

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
            .id(entry.getId())
            .entryNumber(entry.getEntryNumber())
            .entryDate(entry.getEntryDate())
            .fiscalYear(entry.getFiscalYear())
            .fiscalMonth(entry.getFiscalMonth())
            .description(entry.getDescription())
            .reference(entry.getReference())
            .entryType(entry.getEntryType())
            .status(entry.getStatus())
            .totalDebits(entry.getDebitTotal())
            .totalCredits(entry.getCreditTotal())
            .lines(entry.getLines().stream().map(Line::from).toList())
            .createdBy(entry.getCreatedBy())
            .postedBy(entry.getPostedBy())
            .postedAt(entry.getPostedAt())
            .voidedBy(entry.getVoidedBy())
            .voidedAt(entry.getVoidedAt())
            .voidReason(entry.getVoidReason())
            .createdAt(entry.getCreatedAt())
            .build();
    }

    @Value
    public static class Line {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("line_number")
        int lineNumber;

        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("direction")
        Direction direction;

        @JsonProperty("amount")
        long amount;

        @JsonProperty("memo")
        String memo;

        static Line from(JournalLine line) {
            return new Line(line.getId(), line.getLineNumber(), line.getAccountId(),
                line.getDirection(), line.getAmount(), line.getMemo());
        }
    }
}
