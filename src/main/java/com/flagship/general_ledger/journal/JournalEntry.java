package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A double-entry journal entry with its lines.
 *
 * State machine: DRAFT -> POSTED -> VOIDED, one way only. A posted entry is
 * never edited; mistakes are voided (and re-entered) instead. Transitions
 * return a new instance.
 */
@Value
@Builder(toBuilder = true)
public class JournalEntry {

    public static final int MIN_VOID_REASON_LENGTH = 3;

    UUID id;
    String entryNumber;
    LocalDate entryDate;
    String description;
    String reference;
    JournalEntryType entryType;
    JournalEntryStatus status;
    List<JournalLine> lines;
    String createdBy;
    String postedBy;
    Instant postedAt;
    String voidedBy;
    Instant voidedAt;
    String voidReason;
    Instant createdAt;

    /**
     * Builds a DRAFT entry from a validated request.
     */
    public static JournalEntry draft(UUID id, String entryNumber, JournalEntryRequest request) {
        request.validate();

        List<JournalLine> lines = new ArrayList<>(request.getLines().size());
        int lineNumber = 1;
        for (JournalEntryRequest.Line line : request.getLines()) {
            lines.add(new JournalLine(UUID.randomUUID(), id, lineNumber++,
                line.getAccountId(), line.getDirection(), line.getAmount(), line.getMemo()));
        }

        return JournalEntry.builder()
            .id(id)
            .entryNumber(entryNumber)
            .entryDate(request.getEntryDate())
            .description(request.getDescription().trim())
            .reference(request.getReference())
            .entryType(request.getEntryType())
            .status(JournalEntryStatus.DRAFT)
            .lines(List.copyOf(lines))
            .createdBy(request.getCreatedBy())
            .createdAt(Instant.now())
            .build();
    }

    public static String formatEntryNumber(int year, long sequence) {
        return String.format("JE-%d-%06d", year, sequence);
    }

    /**
     * DRAFT -> POSTED. Re-checks the balance of the lines.
     *
     * @throws InvalidStateException unless DRAFT
     * @throws ValidationException if the lines do not balance
     */
    public JournalEntry post(String postedBy) {
        if (status != JournalEntryStatus.DRAFT) {
            throw new InvalidStateException(String.format(
                "Cannot post journal entry %s in %s status. Only DRAFT entries can be posted.",
                entryNumber, status));
        }
        if (postedBy == null || postedBy.isBlank()) {
            throw new ValidationException("Posted by is required");
        }
        if (lines.size() < 2 || getDebitTotal() != getCreditTotal()) {
            throw new ValidationException(String.format(
                "Journal entry %s is not balanced: debits=%d, credits=%d",
                entryNumber, getDebitTotal(), getCreditTotal()));
        }
        return toBuilder()
            .status(JournalEntryStatus.POSTED)
            .postedBy(postedBy)
            .postedAt(Instant.now())
            .build();
    }

    /**
     * POSTED -> VOIDED. No reversing entry is generated.
     *
     * @throws InvalidStateException unless POSTED
     * @throws ValidationException if the reason is shorter than 3 characters
     */
    public JournalEntry voidEntry(String reason, String voidedBy) {
        if (status != JournalEntryStatus.POSTED) {
            throw new InvalidStateException(String.format(
                "Cannot void journal entry %s in %s status. Only POSTED entries can be voided.",
                entryNumber, status));
        }
        if (reason == null || reason.trim().length() < MIN_VOID_REASON_LENGTH) {
            throw new ValidationException(
                "Void reason must be at least " + MIN_VOID_REASON_LENGTH + " characters");
        }
        if (voidedBy == null || voidedBy.isBlank()) {
            throw new ValidationException("Voided by is required");
        }
        return toBuilder()
            .status(JournalEntryStatus.VOIDED)
            .voidedBy(voidedBy)
            .voidedAt(Instant.now())
            .voidReason(reason.trim())
            .build();
    }

    public int getFiscalYear() {
        return entryDate.getYear();
    }

    public int getFiscalMonth() {
        return entryDate.getMonthValue();
    }

    public long getDebitTotal() {
        return lines.stream().filter(JournalLine::isDebit).mapToLong(JournalLine::getAmount).sum();
    }

    public long getCreditTotal() {
        return lines.stream().filter(l -> !l.isDebit()).mapToLong(JournalLine::getAmount).sum();
    }
}
