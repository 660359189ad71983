package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
public class ReconcilingItem {
    UUID id;
    UUID reconciliationId;
    ReconcilingItemType itemType;
    String description;
    long amount;
    LocalDate itemDate;
    String reference;
    boolean requiresJournalEntry;
    UUID journalEntryId;
    UUID bankTransactionId;
    String createdBy;
    Instant createdAt;

    /**
     * @param requiresJournalEntry null takes the item type's default
     * @throws ValidationException if the amount breaks the type's sign rule
     */
    public static ReconcilingItem create(UUID reconciliationId, ReconcilingItemType itemType, String description,
                                         long amount, LocalDate itemDate, String reference,
                                         Boolean requiresJournalEntry, UUID bankTransactionId, String createdBy) {
        if (itemType == null) {
            throw new ValidationException("Item type is required");
        }
        if (description == null || description.isBlank()) {
            throw new ValidationException("Description is required");
        }
        if (itemDate == null) {
            throw new ValidationException("Item date is required");
        }
        if (itemType.isSigned()) {
            if (amount == 0) {
                throw new ValidationException("Adjustment amount must not be zero");
            }
        } else if (amount <= 0) {
            throw new ValidationException(itemType + " amount must be positive");
        }
        if (createdBy == null || createdBy.isBlank()) {
            throw new ValidationException("Created by is required");
        }

        return ReconcilingItem.builder()
            .id(UUID.randomUUID())
            .reconciliationId(reconciliationId)
            .itemType(itemType)
            .description(description.trim())
            .amount(amount)
            .itemDate(itemDate)
            .reference(reference)
            .requiresJournalEntry(requiresJournalEntry != null
                ? requiresJournalEntry
                : itemType.requiresJournalEntryByDefault())
            .bankTransactionId(bankTransactionId)
            .createdBy(createdBy)
            .createdAt(Instant.now())
            .build();
    }

    public boolean needsAdjustingEntry() {
        return requiresJournalEntry && journalEntryId == null;
    }
}
