package com.flagship.general_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.journal.Direction;
import com.flagship.general_ledger.journal.JournalEntryRequest;
import com.flagship.general_ledger.journal.JournalEntryType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.UUID;

@Value
public class CreateJournalEntryRequest {

    /**
     * ISO-8601 date-time ("2026-01-05T10:00:00Z", "2026-01-05T10:00:00") or plain date ("2026-01-05").
     * A date-time is booked on its calendar date in its own offset, or as written when it has none.
     */
    @NotBlank(message = "Entry date is required")
    @JsonProperty("entry_date")
    String entryDate;

    @NotBlank(message = "Description is required")
    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    String description;

    @Size(max = 100, message = "Reference must be at most 100 characters")
    @JsonProperty("reference")
    String reference;

    @NotNull(message = "Entry type is required")
    @JsonProperty("entry_type")
    JournalEntryType entryType;

    @NotBlank(message = "Created by is required")
    @JsonProperty("created_by")
    String createdBy;

    @NotEmpty(message = "Lines are required")
    @Valid
    @JsonProperty("lines")
    List<LineRequest> lines;

    public JournalEntryRequest toDomain() {
        return new JournalEntryRequest(
            parseEntryDate(entryDate),
            description,
            reference,
            entryType,
            createdBy,
            lines.stream()
                .map(l -> new JournalEntryRequest.Line(l.getAccountId(), l.getDirection(), l.getAmount(), l.getMemo()))
                .toList());
    }

    static LocalDate parseEntryDate(String value) {
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value);
            }
            return LocalDate.from(
                DateTimeFormatter.ISO_DATE_TIME.parseBest(value, OffsetDateTime::from, LocalDateTime::from));
        } catch (DateTimeParseException e) {
            throw new ValidationException("Entry date must be an ISO-8601 date or date-time: " + value, e);
        }
    }

    @Value
    public static class LineRequest {

        @NotNull(message = "Account ID is required")
        @JsonProperty("account_id")
        UUID accountId;

        @NotNull(message = "Direction is required")
        @JsonProperty("direction")
        Direction direction;

        @Positive(message = "Amount must be positive")
        @JsonProperty("amount")
        long amount;

        @Size(max = 500, message = "Memo must be at most 500 characters")
        @JsonProperty("memo")
        String memo;
    }
}
