package com.flagship.general_ledger.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.reconciliation.ReconcilingItemType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
public class AddReconcilingItemRequest {

    @NotNull(message = "Item type is required")
    @JsonProperty("item_type")
    ReconcilingItemType itemType;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    Long amount;

    @NotNull(message = "Item date is required")
    @JsonProperty("item_date")
    LocalDate itemDate;

    @Size(max = 100, message = "Reference must be at most 100 characters")
    @JsonProperty("reference")
    String reference;

    @JsonProperty("requires_journal_entry")
    Boolean requiresJournalEntry;

    @JsonProperty("bank_transaction_id")
    UUID bankTransactionId;

    @NotBlank(message = "Created by is required")
    @JsonProperty("created_by")
    String createdBy;
}
