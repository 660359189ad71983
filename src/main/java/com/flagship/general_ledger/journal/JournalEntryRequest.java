package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.exception.ValidationException;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A journal entry as submitted, before it has an ID or number.
 *
 * Invariant checked by {@link #validate()}: at least two lines, every amount
 * positive, at least one debit and one credit, and debits equal credits exactly.
 */
@Value
public class JournalEntryRequest {
    LocalDate entryDate;
    String description;
    String reference;
    JournalEntryType entryType;
    String createdBy;
    List<Line> lines;

    /**
     * @throws ValidationException on the first rule the request breaks
     */
    public void validate() {
        if (entryDate == null) {
            throw new ValidationException("Entry date is required");
        }
        if (description == null || description.isBlank()) {
            throw new ValidationException("Description is required");
        }
        if (entryType == null) {
            throw new ValidationException("Entry type is required");
        }
        if (createdBy == null || createdBy.isBlank()) {
            throw new ValidationException("Created by is required");
        }
        if (lines == null || lines.size() < 2) {
            throw new ValidationException("Journal entry must have at least 2 lines");
        }
        for (int i = 0; i < lines.size(); i++) {
            Line line = lines.get(i);
            if (line == null || line.getAccountId() == null || line.getDirection() == null) {
                throw new ValidationException("Line " + (i + 1) + ": account and direction are required");
            }
            if (line.getAmount() <= 0) {
                throw new ValidationException("Line " + (i + 1) + ": amount must be positive");
            }
        }
        if (lines.stream().noneMatch(l -> l.getDirection() == Direction.DEBIT)) {
            throw new ValidationException("Journal entry must have at least one debit line");
        }
        if (lines.stream().noneMatch(l -> l.getDirection() == Direction.CREDIT)) {
            throw new ValidationException("Journal entry must have at least one credit line");
        }
        if (!isBalanced()) {
            throw new ValidationException(String.format(
                "Journal entry is not balanced: debits=%d, credits=%d", getDebitTotal(), getCreditTotal()));
        }
    }

    public boolean isBalanced() {
        return getDebitTotal() == getCreditTotal();
    }

    /**
     * @throws ValidationException if the sum overflows
     */
    public long getDebitTotal() {
        return sum(Direction.DEBIT);
    }

    public long getCreditTotal() {
        return sum(Direction.CREDIT);
    }

    public List<UUID> accountIds() {
        return lines.stream().map(Line::getAccountId).distinct().toList();
    }

    private long sum(Direction direction) {
        try {
            return lines.stream()
                .filter(l -> l.getDirection() == direction)
                .mapToLong(Line::getAmount)
                .reduce(0L, Math::addExact);
        } catch (ArithmeticException e) {
            throw new ValidationException("Journal entry " + direction.name().toLowerCase() + " total overflows", e);
        }
    }

    @Value
    public static class Line {
        UUID accountId;
        Direction direction;
        long amount;
        String memo;

        public static Line debit(UUID accountId, long amount, String memo) {
            return new Line(Objects.requireNonNull(accountId), Direction.DEBIT, amount, memo);
        }

        public static Line credit(UUID accountId, long amount, String memo) {
            return new Line(Objects.requireNonNull(accountId), Direction.CREDIT, amount, memo);
        }
    }
}
